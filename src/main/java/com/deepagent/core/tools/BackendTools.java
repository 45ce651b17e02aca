package com.deepagent.core.tools;

import com.deepagent.backend.EditResult;
import com.deepagent.backend.ExecuteResult;
import com.deepagent.backend.ExecutionBackend;
import com.deepagent.backend.FileInfo;
import com.deepagent.backend.GrepMatch;
import com.deepagent.backend.ReadResult;
import com.deepagent.backend.WriteResult;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The file and shell tools, each bound to one {@link ExecutionBackend}.
 */
public final class BackendTools {

    public static final String LS = "ls";
    public static final String READ_FILE = "read_file";
    public static final String WRITE_FILE = "write_file";
    public static final String EDIT_FILE = "edit_file";
    public static final String GLOB = "glob";
    public static final String GREP = "grep";
    public static final String EXECUTE = "execute";

    static final String NO_FILES = "No files found";
    static final String NO_MATCHES = "No matches found";
    static final String EMPTY_FILE = "System reminder: File exists but has empty contents";

    private BackendTools() {}

    public static List<AgentTool> fileTools(ExecutionBackend backend) {
        return List.of(ls(backend), readFile(backend), writeFile(backend),
                editFile(backend), glob(backend), grep(backend));
    }

    static AgentTool ls(ExecutionBackend backend) {
        return tool(LS,
                "List the files and directories directly inside a directory. Directories end with '/'.",
                schema(Map.of("path", prop("string", "Directory to list, default '/'")), List.of()),
                args -> renderPaths(backend.ls(ToolArguments.optionalString(args, "path", "/"))));
    }

    static AgentTool readFile(ExecutionBackend backend) {
        return tool(READ_FILE,
                "Read a text file. Returns numbered lines starting at 'offset' (0-based), at most 'limit' lines.",
                schema(Map.of(
                        "file_path", prop("string", "Path of the file to read"),
                        "offset", prop("integer", "First line to read, default 0"),
                        "limit", prop("integer", "Maximum number of lines, default 2000")),
                        List.of("file_path")),
                args -> {
                    String path = ToolArguments.requireString(args, "file_path");
                    int offset = ToolArguments.optionalInt(args, "offset", 0);
                    int limit = ToolArguments.optionalInt(args, "limit", ExecutionBackend.DEFAULT_READ_LIMIT);
                    ReadResult result = backend.read(path, offset, limit);
                    if (result.isError()) {
                        return "Error: " + result.error();
                    }
                    if (result.content().isEmpty()) {
                        return EMPTY_FILE;
                    }
                    return numberLines(result.content(), Math.max(offset, 0));
                });
    }

    static AgentTool writeFile(ExecutionBackend backend) {
        return tool(WRITE_FILE,
                "Create or overwrite a file with the given content. Parent directories are created.",
                schema(Map.of(
                        "file_path", prop("string", "Path of the file to write"),
                        "content", prop("string", "Full new content of the file")),
                        List.of("file_path", "content")),
                args -> {
                    WriteResult result = backend.write(ToolArguments.requireString(args, "file_path"),
                            ToolArguments.requireString(args, "content"));
                    return result.isError() ? "Error: " + result.error() : "Updated file " + result.path();
                });
    }

    static AgentTool editFile(ExecutionBackend backend) {
        return tool(EDIT_FILE,
                "Replace an exact string in a file. Fails when the string is absent. "
                        + "Replaces only the first occurrence unless replace_all is true.",
                schema(Map.of(
                        "file_path", prop("string", "Path of the file to edit"),
                        "old_string", prop("string", "Exact text to replace"),
                        "new_string", prop("string", "Replacement text"),
                        "replace_all", prop("boolean", "Replace every occurrence, default false")),
                        List.of("file_path", "old_string", "new_string")),
                args -> {
                    EditResult result = backend.edit(
                            ToolArguments.requireString(args, "file_path"),
                            ToolArguments.requireString(args, "old_string"),
                            ToolArguments.requireString(args, "new_string"),
                            ToolArguments.optionalBoolean(args, "replace_all", false));
                    if (result.isError()) {
                        return "Error: " + result.error();
                    }
                    return "Successfully replaced " + result.occurrences() + " instance(s) of the string in '"
                            + result.path() + "'";
                });
    }

    static AgentTool glob(ExecutionBackend backend) {
        return tool(GLOB,
                "Find files whose path (relative to 'path') matches a glob pattern such as '**/*.py'.",
                schema(Map.of(
                        "pattern", prop("string", "Glob pattern"),
                        "path", prop("string", "Directory to search, default '/'")),
                        List.of("pattern")),
                args -> renderPaths(backend.glob(ToolArguments.requireString(args, "pattern"),
                        ToolArguments.optionalString(args, "path", "/"))));
    }

    static AgentTool grep(ExecutionBackend backend) {
        return tool(GREP,
                "Search file contents for a literal string. output_mode is 'files_with_matches' (default), "
                        + "'content' (path:line:text) or 'count'.",
                schema(Map.of(
                        "pattern", prop("string", "Literal text to search for"),
                        "path", prop("string", "File or directory to search, default '/'"),
                        "glob", prop("string", "Only search files whose name matches this glob"),
                        "output_mode", prop("string", "files_with_matches | content | count")),
                        List.of("pattern")),
                args -> {
                    List<GrepMatch> matches = backend.grep(
                            ToolArguments.requireString(args, "pattern"),
                            ToolArguments.optionalString(args, "path", "/"),
                            ToolArguments.optionalString(args, "glob", null));
                    if (matches.isEmpty()) {
                        return NO_MATCHES;
                    }
                    String mode = ToolArguments.optionalString(args, "output_mode", "files_with_matches");
                    return switch (mode) {
                        case "content" -> matches.stream().map(GrepMatch::render).collect(Collectors.joining("\n"));
                        case "count" -> matches.stream()
                                .collect(Collectors.groupingBy(GrepMatch::path, LinkedHashMap::new, Collectors.counting()))
                                .entrySet().stream()
                                .map(e -> e.getKey() + ": " + e.getValue())
                                .collect(Collectors.joining("\n"));
                        default -> String.join("\n", matches.stream()
                                .map(GrepMatch::path)
                                .collect(Collectors.toCollection(LinkedHashSet::new)));
                    };
                });
    }

    static AgentTool execute(ExecutionBackend backend) {
        return tool(EXECUTE,
                "Run a shell command in the workspace and return its combined output and exit code.",
                schema(Map.of("command", prop("string", "Shell command to run")), List.of("command")),
                args -> renderExecution(backend.execute(ToolArguments.requireString(args, "command"))));
    }

    static String renderExecution(ExecuteResult result) {
        var sb = new StringBuilder(result.output());
        if (sb.length() > 0 && sb.charAt(sb.length() - 1) != '\n') {
            sb.append('\n');
        }
        if (result.succeeded()) {
            sb.append("[Command succeeded with exit code 0]");
        } else {
            sb.append("[Command failed with exit code ").append(result.exitCode()).append(']');
        }
        if (result.truncated()) {
            sb.append("\n[Output was truncated due to size limits]");
        }
        return sb.toString();
    }

    private static String renderPaths(List<FileInfo> entries) {
        if (entries.isEmpty()) {
            return NO_FILES;
        }
        return entries.stream()
                .map(e -> e.directory() ? e.path() + "/" : e.path())
                .collect(Collectors.joining("\n"));
    }

    private static String numberLines(String content, int firstLine) {
        var sb = new StringBuilder();
        String[] lines = content.split("\n", -1);
        int count = content.endsWith("\n") ? lines.length - 1 : lines.length;
        for (int i = 0; i < count; i++) {
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(String.format("%6d\t%s", firstLine + i + 1, lines[i]));
        }
        return sb.toString();
    }

    private static Map<String, Object> prop(String type, String description) {
        return Map.of("type", type, "description", description);
    }

    private static Map<String, Object> schema(Map<String, Object> properties, List<String> required) {
        var schema = new LinkedHashMap<String, Object>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", required);
        return schema;
    }

    private static AgentTool tool(String name, String description, Map<String, Object> schema,
                                  Function<Map<String, Object>, String> body) {
        return new BoundTool(new ToolSpec(name, description, schema), body);
    }

    private record BoundTool(ToolSpec spec, Function<Map<String, Object>, String> body) implements AgentTool {
        @Override
        public String execute(Map<String, Object> arguments) {
            return body.apply(arguments == null ? Map.of() : arguments);
        }
    }
}
