package projectconic.io;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import projectconic.config.SoundingConfig;
import projectconic.domain.exception.SchemaException;
import projectconic.domain.sounding.SoundingColumns;
import projectconic.domain.sounding.SoundingTable;
import projectconic.physics.model.DepthProfileModel;
import projectconic.physics.model.HydrostaticPorePressureModel;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Carga un sondeo desde texto delimitado con cabecera.
 * <p>
 * Las cabeceras se traducen a las columnas canónicas según
 * {@link SoundingConfig.ColumnMapping}; las columnas no reconocidas se ignoran.
 * Todos los valores se leen como {@code double}. Una celda vacía es un valor
 * ausente (NaN); cualquier otro contenido no numérico es un error de esquema.
 * Si falta u0 se genera con {@link HydrostaticPorePressureModel}.
 */
@Slf4j
public class SoundingCsvReader {

    // Thread-safe una vez configurado, se reutiliza
    private static final CsvMapper csvMapper = new CsvMapper();

    private final DepthProfileModel porePressureModel;

    public SoundingCsvReader() {
        this(new HydrostaticPorePressureModel());
    }

    public SoundingCsvReader(DepthProfileModel porePressureModel) {
        this.porePressureModel = porePressureModel;
    }

    /**
     * @throws IOException     Si el fichero no existe o no puede leerse.
     * @throws SchemaException Si faltan columnas requeridas o hay celdas no numéricas.
     */
    public SoundingTable read(Path path, SoundingConfig config) throws IOException {
        log.info("Leyendo sondeo desde {}", path.toAbsolutePath());
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, config);
        } catch (IOException e) {
            log.error("Error al leer el sondeo desde {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    public SoundingTable read(Reader reader, SoundingConfig config) throws IOException {
        SoundingConfig.ColumnMapping mapping = config.getColumns();
        List<String[]> records = readRecords(reader, mapping.getSeparator());

        // Sin cabecera: se informan como ausentes todas las columnas requeridas
        String[] header = records.isEmpty() ? new String[0] : records.get(0);
        Map<String, Integer> headerIndex = new LinkedHashMap<>();
        for (int c = 0; c < header.length; c++) {
            headerIndex.putIfAbsent(header[c].trim(), c);
        }

        // Columnas canónicas -> posición en el fichero
        Map<String, String> canonicalToHeader = new LinkedHashMap<>();
        canonicalToHeader.put(SoundingColumns.DEPTH, mapping.getDepth());
        canonicalToHeader.put(SoundingColumns.QC, mapping.getQc());
        canonicalToHeader.put(SoundingColumns.FS, mapping.getFs());
        canonicalToHeader.put(SoundingColumns.U2, mapping.getU2());
        canonicalToHeader.put(SoundingColumns.U0, mapping.getU0());

        List<String> missing = new ArrayList<>();
        for (String required : SoundingColumns.REQUIRED_INPUT) {
            if (!headerIndex.containsKey(canonicalToHeader.get(required))) {
                missing.add(canonicalToHeader.get(required));
            }
        }
        if (!missing.isEmpty()) {
            throw new SchemaException(missing);
        }

        boolean hasU0 = headerIndex.containsKey(mapping.getU0());
        List<String[]> rows = records.subList(1, records.size());

        Map<String, double[]> columns = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : canonicalToHeader.entrySet()) {
            Integer position = headerIndex.get(entry.getValue());
            if (position == null) continue;
            columns.put(entry.getKey(), parseColumn(rows, position, header.length, entry.getValue()));
        }

        if (!hasU0) {
            log.info("Columna '{}' ausente: se calcula u0 hidrostática (γw={}, nivel freático={})",
                    mapping.getU0(), config.getGammaW(), config.getWaterLevel());
            columns.put(SoundingColumns.U0,
                    porePressureModel.generateProfile(columns.get(SoundingColumns.DEPTH), config));
        }

        SoundingTable table = SoundingTable.of(columns);
        log.info("Sondeo cargado: {} registros", table.getRowCount());
        return table;
    }

    // --- Helpers ---

    private static List<String[]> readRecords(Reader reader, char separator) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withColumnSeparator(separator);
        List<String[]> records = new ArrayList<>();
        try (MappingIterator<String[]> iterator = csvMapper
                .readerFor(String[].class)
                .with(schema)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                .readValues(reader)) {
            while (iterator.hasNext()) {
                records.add(iterator.next());
            }
        }
        return records;
    }

    private static double[] parseColumn(List<String[]> rows, int position, int expectedWidth, String header) {
        double[] values = new double[rows.size()];
        for (int r = 0; r < rows.size(); r++) {
            String[] row = rows.get(r);
            if (row.length != expectedWidth) {
                throw new SchemaException(String.format(
                        "El registro %d tiene %d campos, la cabecera tiene %d.", r + 1, row.length, expectedWidth));
            }
            values[r] = parseCell(row[position], r + 1, header);
        }
        return values;
    }

    private static double parseCell(String raw, int rowNumber, String header) {
        String cell = raw == null ? "" : raw.trim();
        if (cell.isEmpty()) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(cell);
        } catch (NumberFormatException e) {
            throw new SchemaException(String.format(
                    "Valor no numérico '%s' en el registro %d, columna '%s'.", cell, rowNumber, header), e);
        }
    }
}
