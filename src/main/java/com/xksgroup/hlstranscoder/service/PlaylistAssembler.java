package com.xksgroup.hlstranscoder.service;

import com.xksgroup.hlstranscoder.model.VariantInfo;
import com.xksgroup.hlstranscoder.service.helper.StorageKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the master playlist from the renditions that made it to {@code ready}.
 * Output only depends on the set of variants, never on their order.
 */
@Slf4j
@Component
public class PlaylistAssembler {

    static final String DEFAULT_CODECS = "avc1.4d401f,mp4a.40.2";

    private static final Comparator<VariantInfo> LADDER_ORDER = Comparator
            .comparingInt(VariantInfo::getHeight)
            .thenComparingInt(VariantInfo::getWidth)
            .thenComparingLong(VariantInfo::getBandwidth);

    public String assemble(List<VariantInfo> variants) {
        if (variants == null || variants.isEmpty()) {
            throw new IllegalArgumentException("cannot build a master playlist without variants");
        }

        List<VariantInfo> sorted = new ArrayList<>(variants);
        sorted.sort(LADDER_ORDER);

        StringBuilder masterContent = new StringBuilder();
        masterContent.append("#EXTM3U\n");
        masterContent.append("#EXT-X-VERSION:3\n");

        Set<Integer> seenHeights = new HashSet<>();
        for (VariantInfo variant : sorted) {
            if (!seenHeights.add(variant.getHeight())) {
                log.debug("Dropping duplicate {}p variant from master playlist", variant.getHeight());
                continue;
            }
            String codecs = variant.getCodecs() != null ? variant.getCodecs() : DEFAULT_CODECS;
            masterContent.append("#EXT-X-STREAM-INF:");
            masterContent.append("BANDWIDTH=").append(variant.getBandwidth());
            masterContent.append(",RESOLUTION=").append(variant.getResolution());
            masterContent.append(",CODECS=\"").append(codecs).append("\"\n");
            masterContent.append(StorageKeys.relativeVariantUri(variant.getHeight())).append('\n');
        }
        return masterContent.toString();
    }
}
