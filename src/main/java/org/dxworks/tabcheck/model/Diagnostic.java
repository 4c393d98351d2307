package org.dxworks.tabcheck.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"ruleId", "ruleName", "title", "severity", "category", "message", "help", "arguments",
        "filePath", "location", "container", "position", "declaredOrder"})
public class Diagnostic {
    public String ruleId;
    public String ruleName;
    public String title;
    public Severity severity;
    public String category;
    public String message;
    public String help;
    public List<String> arguments = new ArrayList<>();
    public String filePath;
    public SourceLocation location;
    public String container;
    public Integer position;
    public Integer declaredOrder;
}
