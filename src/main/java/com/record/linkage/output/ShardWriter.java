package com.record.linkage.output;

import com.record.linkage.core.model.MatchResult;
import com.record.linkage.core.model.StrictnessTier;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Writes match results as CSV shards.
 *
 * <p>Columns: {@code indv_id_a, indv_id_b, idx_a, idx_b, pass_name}, one 1/0 flag per
 * strictness tier, {@code weight}, then one column per comparer variable. Scores a
 * pass does not produce, and NaN scores, are left blank. Infinite scores are written as
 * {@code Infinity} or {@code -Infinity}.</p>
 */
public class ShardWriter {

    static final List<String> FIXED_COLUMNS = List.of("indv_id_a", "indv_id_b", "idx_a", "idx_b", "pass_name");

    private final Path directory;
    private final List<String> comparerColumns;

    public ShardWriter(Path directory, List<String> comparerColumns) {
        if (directory == null) {
            throw new IllegalArgumentException("directory is required");
        }
        this.directory = directory;
        this.comparerColumns = comparerColumns != null ? List.copyOf(comparerColumns) : List.of();
    }

    public Path getDirectory() {
        return directory;
    }

    public List<String> header() {
        List<String> header = new ArrayList<>(FIXED_COLUMNS);
        for (StrictnessTier tier : StrictnessTier.values()) {
            header.add(tier.getColumnName());
        }
        header.add("weight");
        header.addAll(comparerColumns);
        return header;
    }

    /**
     * Writes a complete shard, replacing any existing file of the same name.
     */
    public Path writeShard(String fileName, Collection<MatchResult> results) {
        try (Shard shard = openShard(fileName)) {
            shard.append(results);
            return shard.getPath();
        }
    }

    /**
     * Opens a shard for incremental appends. The header is written immediately.
     */
    public Shard openShard(String fileName) {
        Path path = directory.resolve(fileName);
        try {
            Files.createDirectories(directory);
            BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
            writer.write(String.join(",", header()));
            writer.newLine();
            return new Shard(path, writer);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open shard " + path, e);
        }
    }

    private String formatRow(MatchResult result) {
        List<String> cells = new ArrayList<>();
        cells.add(csvEscape(result.pair().identifierA()));
        cells.add(csvEscape(result.pair().identifierB()));
        cells.add(Long.toString(result.pair().ordinalA()));
        cells.add(Long.toString(result.pair().ordinalB()));
        cells.add(csvEscape(result.passName()));
        for (StrictnessTier tier : StrictnessTier.values()) {
            cells.add(result.isMatch(tier) ? "1" : "0");
        }
        cells.add(formatNumber(result.weight()));
        for (String column : comparerColumns) {
            Double score = result.scores().get(column);
            cells.add(score != null ? formatNumber(score) : "");
        }
        return String.join(",", cells);
    }

    static String formatNumber(double value) {
        if (Double.isNaN(value)) {
            return "";
        }
        if (Double.isInfinite(value)) {
            return Double.toString(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static String csvEscape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    /**
     * An open shard file.
     */
    public final class Shard implements AutoCloseable {
        private final Path path;
        private final BufferedWriter writer;
        private long rows;

        private Shard(Path path, BufferedWriter writer) {
            this.path = path;
            this.writer = writer;
        }

        public void append(Collection<MatchResult> results) {
            try {
                for (MatchResult result : results) {
                    writer.write(formatRow(result));
                    writer.newLine();
                    rows++;
                }
                writer.flush();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write shard " + path, e);
            }
        }

        public Path getPath() {
            return path;
        }

        public long getRowCount() {
            return rows;
        }

        @Override
        public void close() {
            try {
                writer.close();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to close shard " + path, e);
            }
        }
    }
}
