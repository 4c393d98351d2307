package org.dxworks.tabcheck.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of analyzing one source file: the scopes that were found and the diagnostics
 * reported for them.
 */
@JsonPropertyOrder({"kind", "filePath", "language", "scopes", "diagnostics"})
public class FileReport {
    public String kind = "file";
    public String filePath;
    public String language = "csharp";
    public List<String> scopes = new ArrayList<>();
    public List<Diagnostic> diagnostics = new ArrayList<>();

    public FileReport() {
    }

    public FileReport(String filePath) {
        this.filePath = filePath;
    }
}
