package com.di.featurenova.pipeline.table;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CSV persistence of {@link FeatureTable}s: header row, comma separated,
 * RFC 4180 quoting, missing cells as empty fields.
 *
 * <p>The column kinds resolved at ingestion travel next to the partitions in
 * a {@value #COLUMN_KINDS_FILE} sidecar, so a partition whose categorical
 * values all look numeric is not re-read as numeric.
 */
public final class FeatureTableCsv {

    public static final String COLUMN_KINDS_FILE = "column_kinds.json";

    private static final CsvMapper CSV = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .build();

    private static final ObjectMapper JSON = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();

    private static final TypeReference<LinkedHashMap<String, ColumnKind>> KINDS_TYPE = new TypeReference<>() {
    };

    private FeatureTableCsv() {
    }

    /**
     * Writes {@code table} to a new file. Fails if the file already exists;
     * artifacts are written once.
     */
    public static void write(FeatureTable table, Path file) throws IOException {
        Files.createDirectories(file.getParent());
        CsvSchema.Builder schema = CsvSchema.builder();
        table.columns().forEach(schema::addColumn);
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
             SequenceWriter seq = CSV.writerFor(String[].class)
                     .with(schema.build().withHeader())
                     .writeValues(out)) {
            for (String[] row : table.toTextRows()) {
                seq.write(row);
            }
        }
    }

    /** Reads {@code file} with the kinds of its sidecar, or inferred kinds when there is none. */
    public static FeatureTable read(Path file) throws IOException {
        return read(file, readKinds(file));
    }

    /** Reads {@code file} with {@code kinds} pinned; other columns are inferred. */
    public static FeatureTable read(Path file, Map<String, ColumnKind> kinds) throws IOException {
        List<String[]> lines = readLines(file);
        if (lines.isEmpty()) {
            throw new IOException("CSV file " + file + " has no header row");
        }
        List<String> header = Arrays.asList(lines.get(0));
        List<String[]> rows = new ArrayList<>(lines.size() - 1);
        for (int i = 1; i < lines.size(); i++) {
            String[] cells = lines.get(i);
            if (cells.length == 1 && cells[0].isEmpty() && header.size() > 1) {
                continue;
            }
            if (cells.length > header.size()) {
                throw new IOException("CSV file " + file + " line " + (i + 1) + " has " + cells.length
                        + " fields, header has " + header.size());
            }
            rows.add(cells);
        }
        return FeatureTable.fromRawRows(header, rows, kinds);
    }

    /** Sidecar holding the column kinds of the partitions in the directory of {@code csvFile}. */
    public static Path kindsFile(Path csvFile) {
        return csvFile.resolveSibling(COLUMN_KINDS_FILE);
    }

    /** Writes the kinds of {@code table} as the sidecar of {@code csvFile}. Fails if it exists. */
    public static void writeKinds(FeatureTable table, Path csvFile) throws IOException {
        Path file = kindsFile(csvFile);
        Files.createDirectories(file.getParent());
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
            JSON.writeValue(out, table.kinds());
        }
    }

    /** Kinds from the sidecar of {@code csvFile}; empty when there is no sidecar. */
    public static Map<String, ColumnKind> readKinds(Path csvFile) throws IOException {
        Path file = kindsFile(csvFile);
        if (!Files.exists(file)) {
            return Map.of();
        }
        return JSON.readValue(file.toFile(), KINDS_TYPE);
    }

    /** Column names from the header row only; the body is not parsed. */
    public static List<String> readHeader(Path file) throws IOException {
        try (BufferedReader in = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             MappingIterator<String[]> it = CSV.readerFor(String[].class).readValues(in)) {
            if (!it.hasNextValue()) {
                throw new IOException("CSV file " + file + " has no header row");
            }
            return List.of(it.nextValue());
        }
    }

    private static List<String[]> readLines(Path file) throws IOException {
        try (BufferedReader in = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             MappingIterator<String[]> it = CSV.readerFor(String[].class).readValues(in)) {
            return it.readAll();
        }
    }
}
