package com.github.stormino.medialib.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AcquisitionRequest {

    private String url;

    /**
     * Optional title for the tenant's library; the discovered title is used otherwise.
     */
    private String title;

    private Map<String, Object> metadata;
}
