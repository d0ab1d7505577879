package com.eyelevel.lotprocessor.common.apiclient.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Static headers applied to every request sent by one API client.
 */
@Getter
public class HeaderConfig {

    private final List<Header> headers;

    public HeaderConfig(List<Header> headers) {
        this.headers = Collections.unmodifiableList(new ArrayList<>(headers));
    }

    public static HeaderConfig of(Map<String, String> headers) {
        List<Header> list = new ArrayList<>();
        headers.forEach((name, value) -> list.add(new Header(name, value)));
        return new HeaderConfig(list);
    }

    /**
     * Represents a single header with a name and a value.
     */
    public record Header(String name, String value) {
    }
}
