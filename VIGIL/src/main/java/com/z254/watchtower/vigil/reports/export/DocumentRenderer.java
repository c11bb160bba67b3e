package com.z254.watchtower.vigil.reports.export;

/**
 * Turns a {@link ReportDocument} into bytes. Swap the bean to produce another format.
 */
public interface DocumentRenderer {

    String contentType();

    String fileExtension();

    byte[] render(ReportDocument document);
}
