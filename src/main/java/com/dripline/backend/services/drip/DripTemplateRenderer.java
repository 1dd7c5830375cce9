package com.dripline.backend.services.drip;

import com.dripline.backend.models.Lead;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces {@code {{variable}}} placeholders in step templates with lead data.
 * Unknown placeholders are left as they are.
 */
@Component
public class DripTemplateRenderer {

    private static final Pattern VARIABLE_PATTERN = Pattern.compile("\\{\\{([^}]+)\\}\\}");

    public String render(String template, Lead lead) {
        return render(template, variablesFor(lead));
    }

    public String render(String template, Map<String, String> variables) {
        if (template == null) {
            return null;
        }

        Matcher matcher = VARIABLE_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String variableName = matcher.group(1).trim();
            String replacement = variables.get(variableName);
            if (replacement == null) {
                replacement = matcher.group(0);
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);

        return result.toString();
    }

    public Map<String, String> variablesFor(Lead lead) {
        Map<String, String> variables = new HashMap<>();
        variables.put("first_name", nullToEmpty(lead.getFirstName()));
        variables.put("last_name", nullToEmpty(lead.getLastName()));
        variables.put("full_name", lead.getFullName());
        variables.put("email", nullToEmpty(lead.getEmail()));
        variables.put("phone", nullToEmpty(lead.getPhone()));
        variables.put("company", nullToEmpty(lead.getCompany()));
        return variables;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
