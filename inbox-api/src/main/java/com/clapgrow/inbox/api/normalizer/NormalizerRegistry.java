package com.clapgrow.inbox.api.normalizer;

import com.clapgrow.inbox.common.enums.Medium;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Platform tag → normalizer lookup, built once from the normalizer beans.
 */
@Component
@Slf4j
public class NormalizerRegistry {

    private final Map<Medium, PlatformNormalizer> normalizers;

    public NormalizerRegistry(List<PlatformNormalizer> normalizers) {
        Map<Medium, PlatformNormalizer> byMedium = new EnumMap<>(Medium.class);
        for (PlatformNormalizer normalizer : normalizers) {
            PlatformNormalizer previous = byMedium.put(normalizer.medium(), normalizer);
            if (previous != null) {
                throw new IllegalStateException("Two normalizers registered for " + normalizer.medium()
                    + ": " + previous.getClass().getSimpleName() + " and " + normalizer.getClass().getSimpleName());
            }
        }
        this.normalizers = Collections.unmodifiableMap(byMedium);
        log.info("Registered webhook normalizers for {}", this.normalizers.keySet());
    }

    /**
     * @param platform webhook path tag such as "whatsapp"; case-insensitive
     * @return the normalizer, or empty for unknown platforms
     */
    public Optional<PlatformNormalizer> find(String platform) {
        return Medium.fromTag(platform).map(normalizers::get);
    }

    public Map<Medium, PlatformNormalizer> all() {
        return normalizers;
    }
}
