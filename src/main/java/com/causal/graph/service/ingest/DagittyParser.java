package com.causal.graph.service.ingest;

import com.causal.graph.service.error.CausalAnalysisException;
import com.causal.graph.service.error.MalformedGraphException;
import com.causal.graph.service.graph.CausalGraph;
import com.causal.graph.service.graph.NodeRole;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads DAGitty graph definitions, either bare ({@code dag { ... }}) or wrapped in the
 * R script emitted by the graph generation tool ({@code g <- dagitty('dag { ... }')}).
 * Text without any {@code dag} block is read as a plain statement list.
 *
 * Statements are one per line or separated by {@code ;}:
 * <pre>
 *   Hypertension [exposure]
 *   Alzheimers [outcome]
 *   Hypertension -> Stroke -> Alzheimers
 * </pre>
 * Bracketed attributes other than {@code exposure}/{@code outcome} are ignored. Node names
 * may not contain whitespace or any of {@code - < > =}, so a mistyped arrow such as
 * {@code A => B} is reported instead of being read as a single node.
 */
@Slf4j
public class DagittyParser {

    private static final Pattern DAG_OPEN = Pattern.compile("\\bdag\\s*\\{");
    private static final Pattern ATTRIBUTES = Pattern.compile("\\[([^]]*)]");
    private static final String FORWARD = "->";
    private static final String BACKWARD = "<-";
    private static final String BIDIRECTED = "<->";
    private static final Pattern INVALID_NAME_CHARS = Pattern.compile("[\\s<>=-]");

    /**
     * Parses a DAGitty file.
     *
     * @throws MalformedGraphException if the content cannot be read as a graph
     */
    public CausalGraph parse(Path file) {
        try {
            log.info("Reading graph from {}", file);
            return parse(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new CausalAnalysisException("Failed to read graph file: " + file,
                    file.toString(), "IO_ERROR", e);
        }
    }

    /**
     * Parses DAGitty text.
     *
     * @throws MalformedGraphException on malformed edges, an unterminated block or a
     *                                 missing exposure/outcome
     */
    public CausalGraph parse(String text) {
        if (text == null || text.isBlank()) {
            throw new MalformedGraphException("Graph definition is empty");
        }
        var builder = CausalGraph.builder();
        var body = extractBody(text);
        int statements = 0;

        for (int i = 0; i < body.size(); i++) {
            for (String statement : body.get(i).split(";")) {
                var trimmed = statement.trim();
                if (isSkippable(trimmed)) continue;
                parseStatement(trimmed, i + 1, builder);
                statements++;
            }
        }

        var graph = builder.build();
        log.info("Parsed {} statements: {} nodes, {} edges (exposure={}, outcome={})",
                statements, graph.nodeCount(), graph.edgeCount(), graph.exposure(), graph.outcome());
        return graph;
    }

    // ==================== Block Extraction ====================

    private List<String> extractBody(String text) {
        var lines = text.lines().toList();
        for (int i = 0; i < lines.size(); i++) {
            Matcher matcher = DAG_OPEN.matcher(lines.get(i));
            if (matcher.find()) {
                return collectBlock(lines, i, matcher.end());
            }
        }
        if (text.contains("dagitty(")) {
            throw new MalformedGraphException("No 'dag {' block found in graph definition");
        }
        return lines;
    }

    private List<String> collectBlock(List<String> lines, int openLine, int bodyStart) {
        var body = new ArrayList<String>();
        var first = lines.get(openLine).substring(bodyStart);
        int close = first.indexOf('}');
        if (close >= 0) {
            body.add(first.substring(0, close));
            return body;
        }
        body.add(first);
        for (int i = openLine + 1; i < lines.size(); i++) {
            var line = lines.get(i);
            close = line.indexOf('}');
            if (close >= 0) {
                body.add(line.substring(0, close));
                return body;
            }
            body.add(line);
        }
        throw new MalformedGraphException("Unterminated 'dag {' block starting at line " + (openLine + 1));
    }

    // ==================== Statements ====================

    private boolean isSkippable(String statement) {
        return statement.isEmpty() || statement.startsWith("#") || statement.startsWith("//");
    }

    private void parseStatement(String statement, int lineNumber, CausalGraph.Builder builder) {
        if (statement.contains(BIDIRECTED)) {
            throw malformed("Bidirected edges are not supported", statement, lineNumber);
        }
        if (statement.contains(FORWARD)) {
            parseChain(splitChain(statement, FORWARD, lineNumber), builder);
        } else if (statement.contains(BACKWARD)) {
            var nodes = splitChain(statement, BACKWARD, lineNumber);
            parseChain(reversed(nodes), builder);
        } else {
            parseNode(statement, lineNumber, builder);
        }
    }

    private List<String> splitChain(String statement, String arrow, int lineNumber) {
        var parts = Arrays.stream(statement.split(Pattern.quote(arrow), -1))
                .map(part -> stripAttributes(part).trim())
                .toList();
        if (parts.size() < 2 || parts.stream().anyMatch(part -> !isValidName(part))) {
            throw malformed("Malformed edge", statement, lineNumber);
        }
        return parts;
    }

    private void parseChain(List<String> nodes, CausalGraph.Builder builder) {
        for (int i = 0; i + 1 < nodes.size(); i++) {
            builder.edge(nodes.get(i), nodes.get(i + 1));
        }
    }

    private void parseNode(String statement, int lineNumber, CausalGraph.Builder builder) {
        var name = stripAttributes(statement).trim();
        if (!isValidName(name)) {
            throw malformed("Malformed node declaration", statement, lineNumber);
        }
        builder.node(name, roleOf(statement));
    }

    private NodeRole roleOf(String statement) {
        Matcher matcher = ATTRIBUTES.matcher(statement);
        while (matcher.find()) {
            for (String attribute : matcher.group(1).split(",")) {
                var key = attribute.trim().toLowerCase();
                if (key.equals("exposure")) return NodeRole.EXPOSURE;
                if (key.equals("outcome")) return NodeRole.OUTCOME;
            }
        }
        return NodeRole.REGULAR;
    }

    // ==================== Utility Methods ====================

    private boolean isValidName(String name) {
        return !name.isEmpty() && !INVALID_NAME_CHARS.matcher(name).find();
    }

    private String stripAttributes(String text) {
        return ATTRIBUTES.matcher(text).replaceAll("");
    }

    private List<String> reversed(List<String> nodes) {
        var copy = new ArrayList<>(nodes);
        Collections.reverse(copy);
        return copy;
    }

    private MalformedGraphException malformed(String reason, String statement, int lineNumber) {
        return new MalformedGraphException(
                "%s at line %d: '%s'".formatted(reason, lineNumber, statement), statement);
    }
}
