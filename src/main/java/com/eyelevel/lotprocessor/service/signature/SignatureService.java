package com.eyelevel.lotprocessor.service.signature;

import com.eyelevel.lotprocessor.common.json.JsonSerializer;
import com.eyelevel.lotprocessor.config.LotProcessingConfig;
import com.eyelevel.lotprocessor.exception.LotProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Signs and verifies payloads with HMAC-SHA256 over their canonical JSON form, keyed by the shared key.
 * The same scheme covers inbound job requests (signed over the {@code lots} array) and outbound webhook
 * payloads (signed over the whole payload without its {@code signature} field).
 */
@Slf4j
@Service
public class SignatureService {

    private final JsonSerializer canonicalJsonSerializer;
    private final LotProcessingConfig config;

    public SignatureService(@Qualifier("canonicalJsonSerializer") final JsonSerializer canonicalJsonSerializer,
                            final LotProcessingConfig config) {
        this.canonicalJsonSerializer = canonicalJsonSerializer;
        this.config = config;
    }

    public String canonicalize(final Object value) {
        return canonicalJsonSerializer.serialize(value);
    }

    /**
     * @return The lowercase hex HMAC-SHA256 of the canonical form of {@code value}.
     */
    public String sign(final Object value) {
        return hmacHex(canonicalize(value));
    }

    /**
     * Compares in constant time. A missing signature never verifies.
     */
    public boolean verify(final Object value, final String providedSignature) {
        if (providedSignature == null || providedSignature.isBlank()) {
            return false;
        }
        final String expected = sign(value);
        final boolean valid = MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                                                    providedSignature.trim().getBytes(StandardCharsets.UTF_8));
        if (!valid) {
            log.debug("Signature mismatch (provided length {}, expected length {})", providedSignature.length(),
                      expected.length());
        }
        return valid;
    }

    String hmacHex(final String canonical) {
        final String sharedKey = config.getSharedKey();
        if (sharedKey == null || sharedKey.isEmpty()) {
            throw new LotProcessingException("Shared key is not configured (app.processing.shared-key)");
        }
        return new HmacUtils(HmacAlgorithms.HMAC_SHA_256, sharedKey.getBytes(StandardCharsets.UTF_8))
                .hmacHex(canonical.getBytes(StandardCharsets.UTF_8));
    }
}
