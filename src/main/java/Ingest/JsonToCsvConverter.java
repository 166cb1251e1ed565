package Ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.opencsv.ICSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import utils.CsvUtil;
import utils.JsonUtil;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Converts the raw JSON fixtures into delimited files the row sources can read.
 * <p>
 * Each input file must hold a JSON array of objects. Nested objects are flattened with
 * {@code _}-joined keys ({@code shipping_address.city} becomes {@code shipping_address_city}),
 * arrays become comma-joined text and nulls become empty cells. The header is the sorted
 * union of the keys of all records in the file.
 */
public class JsonToCsvConverter {

    private static final Logger log = LoggerFactory.getLogger(JsonToCsvConverter.class);

    private final char delimiter;
    private final String extension;

    public JsonToCsvConverter(char delimiter, String extension) {
        this.delimiter = delimiter;
        this.extension = extension;
    }

    /**
     * Converts every {@code *.json} file of {@code inputDir} into {@code outputDir}.
     *
     * @return the files written; empty when there was nothing to convert
     */
    public List<Path> convertAll(Path inputDir, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        if (!Files.isDirectory(inputDir)) {
            log.warn("No JSON files found in {}", inputDir);
            return List.of();
        }

        List<Path> jsonFiles;
        try (Stream<Path> listing = Files.list(inputDir)) {
            jsonFiles = listing
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .collect(Collectors.toList());
        }
        if (jsonFiles.isEmpty()) {
            log.warn("No JSON files found in {}", inputDir);
            return List.of();
        }
        log.info("Found {} JSON files to process", jsonFiles.size());

        List<Path> written = new ArrayList<>();
        for (Path jsonFile : jsonFiles) {
            String baseName = jsonFile.getFileName().toString();
            String name = baseName.substring(0, baseName.length() - ".json".length());
            Path target = outputDir.resolve(name + "." + extension);
            if (convert(jsonFile, target)) {
                written.add(target);
            }
        }

        log.info("Processed {} JSON files", jsonFiles.size());
        return written;
    }

    /**
     * Converts a single file.
     *
     * @return false if the array was empty and no file was written
     * @throws IOException if the file is unreadable or not an array of objects
     */
    public boolean convert(Path jsonFile, Path target) throws IOException {
        JsonNode root = JsonUtil.readTree(jsonFile);
        if (root == null || !root.isArray()) {
            throw new IOException(jsonFile + " does not contain a JSON array");
        }
        if (root.size() == 0) {
            log.warn("{} contains no data.", jsonFile);
            return false;
        }

        List<Map<String, String>> records = new ArrayList<>(root.size());
        TreeSet<String> fieldNames = new TreeSet<>();
        for (JsonNode element : root) {
            if (!element.isObject()) {
                throw new IOException(jsonFile + " contains a non-object element: " + element);
            }
            Map<String, String> flat = new LinkedHashMap<>();
            flatten(element, "", flat);
            fieldNames.addAll(flat.keySet());
            records.add(flat);
        }

        String[] header = fieldNames.toArray(new String[0]);
        try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             ICSVWriter writer = CsvUtil.openWriter(out, delimiter)) {
            writer.writeNext(header, false);
            String[] line = new String[header.length];
            for (Map<String, String> record : records) {
                for (int i = 0; i < header.length; i++) {
                    line[i] = record.getOrDefault(header[i], "");
                }
                writer.writeNext(line, false);
            }
        }

        log.info("Converted {} to {}", jsonFile, target);
        return true;
    }

    static void flatten(JsonNode node, String prefix, Map<String, String> into) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = prefix + field.getKey();
            JsonNode value = field.getValue();
            if (value.isObject()) {
                flatten(value, key + "_", into);
            } else if (value.isArray()) {
                List<String> parts = new ArrayList<>(value.size());
                for (JsonNode item : value) {
                    parts.add(item.isNull() ? "" : item.asText());
                }
                into.put(key, String.join(",", parts));
            } else if (value.isNull()) {
                into.put(key, "");
            } else {
                into.put(key, value.asText());
            }
        }
    }
}
