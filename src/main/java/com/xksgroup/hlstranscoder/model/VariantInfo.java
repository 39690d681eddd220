package com.xksgroup.hlstranscoder.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One line pair of the master manifest.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VariantInfo {
    private int height;
    private int width;
    private long bandwidth;     // bits per second, video + audio
    private String codecs;

    public String getResolution() {
        return width + "x" + height;
    }
}
