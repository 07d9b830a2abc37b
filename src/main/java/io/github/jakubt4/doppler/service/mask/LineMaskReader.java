package io.github.jakubt4.doppler.service.mask;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.github.jakubt4.doppler.exception.ResourceException;
import io.github.jakubt4.doppler.exception.ValidationException;
import io.github.jakubt4.doppler.model.LineMask;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads line masks from delimited files with a header row.
 *
 * <p>The {@value #WAVE_COLUMN} column is required. An optional weight column supplies line
 * weights (equal weights otherwise). Each inclusion criterion {@code name} selects the
 * boolean or 0/1 column {@value #CRITERION_PREFIX}{@code name}; lines must satisfy all of them.
 */
@Slf4j
@Component
public class LineMaskReader {

    public static final String WAVE_COLUMN = "wave";
    public static final String CRITERION_PREFIX = "crit_";

    private final CsvMapper mapper = new CsvMapper();

    /**
     * @param path         mask file
     * @param weightColumn weight column name, {@code null} for equal weights
     * @param criteria     criterion names without prefix, may be empty
     * @throws ResourceException   if the file cannot be read
     * @throws ValidationException if a required column is missing or a value does not parse
     */
    public LineMask read(final Path path, final String weightColumn, final List<String> criteria) {
        final var id = path.getFileName().toString();
        final var rows = readRows(path);

        final var centers = new ArrayList<Double>();
        final var weights = new ArrayList<Double>();
        for (var r = 0; r < rows.size(); r++) {
            final var row = rows.get(r);
            if (!selected(row, criteria, id, r)) {
                continue;
            }
            centers.add(number(row, WAVE_COLUMN, id, r));
            weights.add(weightColumn == null ? 1.0 : number(row, weightColumn, id, r));
        }

        log.info("Mask [{}] — {} of {} lines pass criteria {}", id, centers.size(), rows.size(),
                criteria == null ? List.of() : criteria);
        return new LineMask(id,
                centers.stream().mapToDouble(Double::doubleValue).toArray(),
                weights.stream().mapToDouble(Double::doubleValue).toArray());
    }

    private List<Map<String, String>> readRows(final Path path) {
        if (!Files.isReadable(path)) {
            throw new ResourceException("Mask file [" + path + "] is not readable");
        }
        final var schema = CsvSchema.emptySchema().withHeader().withColumnSeparator(separator(path));
        try (MappingIterator<Map<String, String>> it = mapper.readerForMapOf(String.class).with(schema).readValues(path.toFile())) {
            return it.readAll();
        } catch (final IOException e) {
            throw new ResourceException("Failed to read mask file [" + path + "]: " + e.getMessage(), e);
        }
    }

    private static char separator(final Path path) {
        final var name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".tsv") ? '\t' : ',';
    }

    private static boolean selected(final Map<String, String> row, final List<String> criteria,
                                    final String id, final int r) {
        if (criteria == null) {
            return true;
        }
        for (final var criterion : criteria) {
            final var column = CRITERION_PREFIX + criterion;
            final var raw = cell(row, column, id, r).toLowerCase(Locale.ROOT);
            final boolean pass = switch (raw) {
                case "true", "1", "1.0" -> true;
                case "false", "0", "0.0" -> false;
                default -> throw new ValidationException("Mask [" + id + "] row " + r + ": column [" + column
                        + "] holds '" + raw + "', expected a boolean or 0/1");
            };
            if (!pass) {
                return false;
            }
        }
        return true;
    }

    private static double number(final Map<String, String> row, final String column, final String id, final int r) {
        final var raw = cell(row, column, id, r);
        try {
            return Double.parseDouble(raw);
        } catch (final NumberFormatException e) {
            throw new ValidationException("Mask [" + id + "] row " + r + ": column [" + column
                    + "] holds '" + raw + "', expected a number");
        }
    }

    private static String cell(final Map<String, String> row, final String column, final String id, final int r) {
        final var value = row.get(column);
        if (value == null) {
            throw new ValidationException("Mask [" + id + "] has no column [" + column + "]");
        }
        return value.trim();
    }
}
