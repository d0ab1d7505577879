package com.eyelevel.lotprocessor.dto.job.response;

import com.eyelevel.lotprocessor.model.BatchLot;
import com.eyelevel.lotprocessor.model.LotStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A job's status together with the per-lot results, in request order.
 */
public record JobResultView(JobStatusSnapshot job, List<LotResultView> lots) {

    public record LotResultView(
            String lotId,
            LotStatus status,
            String description,
            Map<String, String> translations,
            List<String> missingImages,
            String errorMessage
    ) {

        public static LotResultView from(BatchLot lot) {
            return new LotResultView(lot.getLotId(), lot.getStatus(), lot.getVisionResult(),
                                     Collections.unmodifiableMap(new LinkedHashMap<>(lot.getTranslations())),
                                     List.copyOf(lot.getMissingImages()), lot.getErrorMessage());
        }
    }
}
