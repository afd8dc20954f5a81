package io.insights.retail;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import io.insights.core.Record;
import io.insights.core.Transform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decodes comma-separated text with a header row into {@link DecodedRow}s.
 *
 * <p>The first row with any non-empty cell is the header. Rows without a non-empty cell are skipped.
 * Cells under {@link #NUMERIC_COLUMNS} are parsed as decimal numbers; a cell that does not parse keeps
 * its text and reports {@link FieldValue#coercionFailed()}. Short rows leave trailing fields absent and
 * long rows lose their extra cells; both only produce warnings.
 */
public class CsvRecordDecoder implements Transform<RawDataset, DecodedDataset> {
    private static final Logger log = LoggerFactory.getLogger(CsvRecordDecoder.class);

    public static final Set<String> NUMERIC_COLUMNS =
            Set.of("Quantity", "Amount", "Stock", "Price", "Rating", "Customer_Age", "Min_Alert");

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private final ObjectReader reader;

    public CsvRecordDecoder() {
        CsvMapper mapper = CsvMapper.builder()
                .enable(CsvParser.Feature.WRAP_AS_ARRAY)
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .build();
        this.reader = mapper.readerFor(String[].class);
    }

    @Override
    public List<Record<DecodedDataset>> apply(Record<RawDataset> input) throws DecodeException {
        return List.of(input.withPayload(decode(input.payload())));
    }

    public DecodedDataset decode(RawDataset raw) throws DecodeException {
        String text = utf8(raw);
        List<String> header = null;
        List<DecodedRow> rows = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        int dataRow = 0;

        try (MappingIterator<String[]> it = reader.readValues(text)) {
            while (it.hasNextValue()) {
                String[] cells = it.nextValue();
                if (isBlankRow(cells)) continue;
                if (header == null) {
                    header = readHeader(cells, warnings);
                    continue;
                }
                dataRow++;
                rows.add(toRow(dataRow, header, cells, warnings));
            }
        } catch (IOException e) {
            throw new DecodeException(raw.name(), "not readable as CSV: " + e.getMessage(), e);
        }

        if (!warnings.isEmpty()) {
            log.warn("{}: {} parse warning(s), first: {}", raw.name(), warnings.size(), warnings.get(0));
        }
        List<String> columns = new ArrayList<>();
        if (header != null) {
            for (String name : header) {
                if (name != null) columns.add(name);
            }
        }
        return new DecodedDataset(raw.kind(), raw.name(), columns, rows, warnings);
    }

    /** Parses {@code text} when it is a plain decimal number, otherwise null. */
    public static Double parseNumber(String text) {
        if (text == null) return null;
        String t = text.trim();
        if (t.isEmpty() || !DECIMAL.matcher(t).matches()) return null;
        return Double.parseDouble(t);
    }

    private static String utf8(RawDataset raw) throws DecodeException {
        try {
            String s = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(raw.data()))
                    .toString();
            return s.startsWith("\uFEFF") ? s.substring(1) : s;
        } catch (CharacterCodingException e) {
            throw new DecodeException(raw.name(), "input is not UTF-8 text", e);
        }
    }

    private static boolean isBlankRow(String[] cells) {
        for (String c : cells) {
            if (c != null && !c.isEmpty()) return false;
        }
        return true;
    }

    // Blank names are dropped (null slot); repeated names keep their first column.
    private static List<String> readHeader(String[] cells, List<String> warnings) {
        List<String> names = new ArrayList<>(cells.length);
        for (int i = 0; i < cells.length; i++) {
            String name = cells[i] == null ? "" : cells[i].trim();
            if (name.isEmpty()) {
                warnings.add("Header column " + (i + 1) + " has no name and is ignored");
                names.add(null);
            } else if (names.contains(name)) {
                warnings.add("Header column " + (i + 1) + " repeats '" + name + "' and is ignored");
                names.add(null);
            } else {
                names.add(name);
            }
        }
        return names;
    }

    private static DecodedRow toRow(int rowNumber, List<String> header, String[] cells, List<String> warnings) {
        if (cells.length != header.size()) {
            warnings.add("Row " + rowNumber + ": expected " + header.size() + " fields but found " + cells.length);
        }
        Map<String, FieldValue> fields = new LinkedHashMap<>();
        int n = Math.min(cells.length, header.size());
        for (int i = 0; i < n; i++) {
            String name = header.get(i);
            if (name == null) continue;
            String cell = cells[i] == null ? "" : cells[i];
            if (NUMERIC_COLUMNS.contains(name)) {
                fields.put(name, FieldValue.numeric(cell, parseNumber(cell)));
            } else {
                fields.put(name, FieldValue.text(cell));
            }
        }
        return new DecodedRow(rowNumber, fields);
    }
}
