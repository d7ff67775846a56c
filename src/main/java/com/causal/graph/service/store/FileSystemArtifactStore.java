package com.causal.graph.service.store;

import com.causal.graph.service.config.MetricsConfig;
import com.causal.graph.service.config.StoreConfig;
import com.causal.graph.service.error.CausalAnalysisException;
import com.causal.graph.service.error.MissingPrerequisiteException;
import com.causal.graph.service.error.InvalidAnalysisIdException;
import com.causal.graph.service.graph.CausalGraph;
import com.causal.graph.service.graph.GraphEdge;
import com.causal.graph.service.graph.NodeRole;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * ArtifactStore that keeps stage outputs on disk so runs can be resumed and inspected:
 * {@code <base-dir>/<analysisId>/<stage-dir>/<key>.csv}.
 *
 * A graph snapshot is {@code graph.csv} with columns {@code kind,from,to}: one row per node
 * ({@code kind} is its role, {@code to} is empty) followed by one {@code edge} row per edge.
 * Node names are stored verbatim, so any name survives the round trip.
 *
 * Versions count writes made by this process; artifacts found on disk from an earlier
 * run report version 1.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "causal.store", name = "type", havingValue = "filesystem")
public class FileSystemArtifactStore implements ArtifactStore {

    private static final String TABLE_SUFFIX = ".csv";
    private static final String GRAPH_FILE = GRAPH_KEY + TABLE_SUFFIX;
    private static final List<String> GRAPH_COLUMNS = List.of("kind", "from", "to");
    private static final String EDGE_KIND = "edge";

    private final Path baseDir;
    private final MetricsConfig metricsConfig;
    private final CsvMapper csvMapper = new CsvMapper();
    private final Map<Path, Integer> versions = new ConcurrentHashMap<>();

    @Autowired
    public FileSystemArtifactStore(StoreConfig storeConfig, MetricsConfig metricsConfig) {
        this(Path.of(storeConfig.getBaseDir()), metricsConfig);
    }

    public FileSystemArtifactStore(Path baseDir, MetricsConfig metricsConfig) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    void init() {
        metricsConfig.registerStoreGauge(
                "causal.store.analyses.count",
                "Number of analyses in the artifact store",
                this::count
        );
        log.info("FileSystemArtifactStore initialized at {}", baseDir.toAbsolutePath());
    }

    // ==================== Graphs ====================

    @Override
    public void putGraph(String analysisId, AnalysisStage stage, CausalGraph graph) {
        var file = graphPath(analysisId, stage);
        writeCsv(file, graphTable(graph));
        bumpVersion(file);
        log.debug("Wrote graph {} (nodes={}, edges={})", file, graph.nodeCount(), graph.edgeCount());
    }

    @Override
    public Optional<CausalGraph> findGraph(String analysisId, AnalysisStage stage) {
        var file = graphPath(analysisId, stage);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(readGraph(file));
    }

    @Override
    public CausalGraph getGraph(String analysisId, AnalysisStage stage) {
        return findGraph(analysisId, stage)
                .orElseThrow(() -> new MissingPrerequisiteException(
                        graphPath(analysisId, stage).toString(), stage.describe()));
    }

    // ==================== Tables ====================

    @Override
    public void putTable(String analysisId, AnalysisStage stage, String key, ArtifactTable table) {
        if (GRAPH_KEY.equals(key)) {
            throw new IllegalArgumentException("Table key '" + GRAPH_KEY + "' is reserved");
        }
        var file = tablePath(analysisId, stage, key);
        writeCsv(file, table);
        bumpVersion(file);
        log.debug("Wrote table {} ({} rows)", file, table.rowCount());
    }

    @Override
    public Optional<ArtifactTable> findTable(String analysisId, AnalysisStage stage, String key) {
        var file = tablePath(analysisId, stage, key);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(readTable(file));
    }

    @Override
    public ArtifactTable getTable(String analysisId, AnalysisStage stage, String key) {
        return findTable(analysisId, stage, key)
                .orElseThrow(() -> new MissingPrerequisiteException(
                        tablePath(analysisId, stage, key).toString(), stage.describe()));
    }

    // ==================== Analyses ====================

    @Override
    public Collection<String> analysisIds() {
        if (!Files.isDirectory(baseDir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(baseDir)) {
            return entries.filter(Files::isDirectory)
                    .map(path -> path.getFileName().toString())
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw ioFailure("list", baseDir, e);
        }
    }

    @Override
    public boolean exists(String analysisId) {
        return Files.isDirectory(analysisDir(analysisId));
    }

    @Override
    public boolean delete(String analysisId) {
        var dir = analysisDir(analysisId);
        if (!Files.isDirectory(dir)) {
            return false;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(path);
                versions.remove(path);
            }
        } catch (IOException e) {
            throw ioFailure("delete", dir, e);
        }
        log.info("Analysis deleted: {}", analysisId);
        return true;
    }

    @Override
    public int count() {
        return analysisIds().size();
    }

    @Override
    public List<ArtifactMetadata> listArtifacts(String analysisId) {
        var result = new ArrayList<ArtifactMetadata>();
        for (AnalysisStage stage : AnalysisStage.values()) {
            var stageDir = analysisDir(analysisId).resolve(stage.getDirectoryName());
            if (!Files.isDirectory(stageDir)) continue;
            try (Stream<Path> files = Files.list(stageDir)) {
                for (Path file : files.sorted().toList()) {
                    metadataFor(analysisId, stage, file).ifPresent(result::add);
                }
            } catch (IOException e) {
                throw ioFailure("list", stageDir, e);
            }
        }
        return result;
    }

    @Override
    public String describe(String analysisId, AnalysisStage stage, String key) {
        return GRAPH_KEY.equals(key)
                ? graphPath(analysisId, stage).toString()
                : tablePath(analysisId, stage, key).toString();
    }

    // ==================== File Helpers ====================

    private Optional<ArtifactMetadata> metadataFor(String analysisId, AnalysisStage stage, Path file)
            throws IOException {
        var name = file.getFileName().toString();
        int rowCount;
        String key;
        if (name.equals(GRAPH_FILE)) {
            key = GRAPH_KEY;
            rowCount = readGraph(file).edgeCount();
        } else if (name.endsWith(TABLE_SUFFIX)) {
            key = name.substring(0, name.length() - TABLE_SUFFIX.length());
            rowCount = readTable(file).rowCount();
        } else {
            return Optional.empty();
        }
        return Optional.of(new ArtifactMetadata(analysisId, stage, key,
                versions.getOrDefault(file, 1), rowCount,
                Files.getLastModifiedTime(file).toMillis()));
    }

    private ArtifactTable readTable(Path file) {
        try (MappingIterator<List<String>> rows = csvMapper.readerForListOf(String.class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .readValues(file.toFile())) {
            var all = rows.readAll();
            if (all.isEmpty()) {
                throw corrupt("Table file has no header", file);
            }
            return new ArtifactTable(all.get(0), all.subList(1, all.size()));
        } catch (IOException e) {
            throw ioFailure("read", file, e);
        }
    }

    private void writeCsv(Path file, ArtifactTable table) {
        try {
            Files.createDirectories(file.getParent());
            try (SequenceWriter out = csvMapper.writerFor(List.class)
                    .with(CsvSchema.emptySchema())
                    .writeValues(file.toFile())) {
                out.write(table.columns());
                for (List<String> row : table.rows()) {
                    out.write(row);
                }
            }
        } catch (IOException e) {
            throw ioFailure("write", file, e);
        }
    }

    private void bumpVersion(Path file) {
        versions.merge(file, 1, Integer::sum);
    }

    private Path analysisDir(String analysisId) {
        var dir = baseDir.resolve(AnalysisIds.requireValid(analysisId)).normalize();
        if (!dir.getParent().equals(baseDir)) {
            throw new InvalidAnalysisIdException(analysisId);
        }
        return dir;
    }

    private Path graphPath(String analysisId, AnalysisStage stage) {
        return analysisDir(analysisId).resolve(stage.getDirectoryName()).resolve(GRAPH_FILE);
    }

    private Path tablePath(String analysisId, AnalysisStage stage, String key) {
        return analysisDir(analysisId).resolve(stage.getDirectoryName()).resolve(key + TABLE_SUFFIX);
    }

    // ==================== Graph Encoding ====================

    static ArtifactTable graphTable(CausalGraph graph) {
        var table = ArtifactTable.builder(GRAPH_COLUMNS.toArray(String[]::new));
        for (String node : graph.nodes()) {
            table.row(graph.roleOf(node).name().toLowerCase(Locale.ROOT), node, "");
        }
        for (GraphEdge edge : graph.edges()) {
            table.row(EDGE_KIND, edge.from(), edge.to());
        }
        return table.build();
    }

    private CausalGraph readGraph(Path file) {
        var table = readTable(file);
        if (!table.columns().equals(GRAPH_COLUMNS)) {
            throw corrupt("Graph file has columns " + table.columns(), file);
        }
        var builder = CausalGraph.builder();
        for (List<String> row : table.rows()) {
            var kind = row.get(0);
            if (EDGE_KIND.equals(kind)) {
                builder.edge(row.get(1), row.get(2));
            } else {
                builder.node(row.get(1), roleOf(kind, file));
            }
        }
        return builder.build();
    }

    private NodeRole roleOf(String kind, Path file) {
        try {
            return NodeRole.valueOf(kind.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw corrupt("Unknown row kind '" + kind + "'", file);
        }
    }

    private CausalAnalysisException corrupt(String reason, Path file) {
        return new CausalAnalysisException(reason + ": " + file, file.toString(), "CORRUPT_ARTIFACT");
    }

    private CausalAnalysisException ioFailure(String action, Path path, IOException e) {
        log.error("Failed to {} {}", action, path, e);
        return new CausalAnalysisException("Failed to %s %s".formatted(action, path),
                path.toString(), "IO_ERROR", e);
    }
}
