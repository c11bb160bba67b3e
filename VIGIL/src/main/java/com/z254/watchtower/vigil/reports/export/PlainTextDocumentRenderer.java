package com.z254.watchtower.vigil.reports.export;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Default renderer producing UTF-8 plain text.
 */
@Component
public class PlainTextDocumentRenderer implements DocumentRenderer {

    @Override
    public String contentType() {
        return "text/plain;charset=UTF-8";
    }

    @Override
    public String fileExtension() {
        return "txt";
    }

    @Override
    public byte[] render(ReportDocument document) {
        StringBuilder out = new StringBuilder();
        out.append(document.getTitle()).append('\n');
        out.append("=".repeat(document.getTitle().length())).append('\n');
        out.append("Generated at ").append(document.getGeneratedAt()).append('\n');
        for (ReportDocument.Section section : document.getSections()) {
            out.append('\n').append(section.getHeading()).append('\n');
            out.append("-".repeat(section.getHeading().length())).append('\n');
            if (section.getLines().isEmpty()) {
                out.append("(none)\n");
            }
            for (String line : section.getLines()) {
                out.append(line).append('\n');
            }
        }
        return out.toString().getBytes(StandardCharsets.UTF_8);
    }
}
