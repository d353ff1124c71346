package com.tclmcp.mcp.discovery;

import java.util.ArrayList;
import java.util.List;

import com.tclmcp.mcp.model.ParameterDefinition;

/**
 * Metadata parsed from the leading comment block of a tool script:
 * <pre>
 * # @description List directory contents
 * # @version 2.0
 * # @param path:string:required Directory path to list
 * </pre>
 * Parsing stops at the first line that is not a comment.
 */
record ScriptHeader(String description, String version, List<ParameterDefinition> parameters) {

    private static final String DESCRIPTION_TAG = "@description ";
    private static final String VERSION_TAG = "@version ";
    private static final String PARAM_TAG = "@param ";

    static ScriptHeader parse(String content) {
        String description = null;
        String version = null;
        final List<ParameterDefinition> parameters = new ArrayList<>();

        for (final String line : content.split("\\R", -1)) {
            final String trimmed = line.stripLeading();
            if (!trimmed.startsWith("#")) {
                break;
            }
            final String comment = stripHashes(trimmed).strip();

            if (comment.startsWith(DESCRIPTION_TAG)) {
                description = comment.substring(DESCRIPTION_TAG.length()).strip();
            } else if (comment.startsWith(VERSION_TAG)) {
                version = comment.substring(VERSION_TAG.length()).strip();
            } else if (comment.startsWith(PARAM_TAG)) {
                final ParameterDefinition param = parseParam(comment.substring(PARAM_TAG.length()));
                if (param != null) {
                    parameters.add(param);
                }
            }
        }
        return new ScriptHeader(description, version, List.copyOf(parameters));
    }

    // name:type[:required] description
    private static ParameterDefinition parseParam(String paramLine) {
        final int space = paramLine.indexOf(' ');
        if (space < 0) {
            return null;
        }
        final String[] fields = paramLine.substring(0, space).split(":");
        if (fields.length < 2) {
            return null;
        }
        final boolean required = fields.length > 2 && fields[2].equals("required");
        return new ParameterDefinition(fields[0], paramLine.substring(space + 1).strip(), required, fields[1]);
    }

    private static String stripHashes(String line) {
        int i = 0;
        while (i < line.length() && line.charAt(i) == '#') {
            i++;
        }
        return line.substring(i);
    }
}
