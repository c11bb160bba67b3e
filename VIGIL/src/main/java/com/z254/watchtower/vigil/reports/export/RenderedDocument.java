package com.z254.watchtower.vigil.reports.export;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RenderedDocument {
    private byte[] content;
    private String contentType;
    private String fileName;
}
