package projectconic.processing;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectconic.domain.exception.InvalidDataException;
import projectconic.domain.sounding.SoundingTable;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;
import static projectconic.domain.sounding.SoundingColumns.DEPTH;
import static projectconic.domain.sounding.SoundingColumns.QC;

class DepthAdjusterTest {

    private DepthAdjuster adjuster;

    @BeforeEach
    void setUp() {
        adjuster = new DepthAdjuster();
    }

    private static SoundingTable tableWithDepth(double... depth) {
        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put(DEPTH, depth);
        double[] qc = new double[depth.length];
        for (int i = 0; i < qc.length; i++) qc[i] = i + 1.0;
        columns.put(QC, qc);
        return SoundingTable.of(columns);
    }

    @Test
    @DisplayName("Espaciado inferido: media de diferencias redondeada a 3 decimales")
    void inferredSpacing_shouldBeRoundedMean() {
        // ARRANGE: diferencias 0.02, 0.02, 0.03 -> media 0.02333 -> 0.023
        SoundingTable table = tableWithDepth(1.0, 1.02, 1.04, 1.07);

        // ACT
        SoundingTable result = adjuster.adjustDepth(table, null, null);

        // ASSERT
        double[] depth = result.getColumn(DEPTH);
        for (int i = 0; i < depth.length; i++) {
            assertEquals(1.0 + i * 0.023, depth[i], 1e-12, "depth[" + i + "]");
        }
        assertArrayEquals(table.getColumn(QC), result.getColumn(QC), "El resto de columnas no cambia.");
    }

    @Test
    @DisplayName("Inicio y espaciado explícitos: el espaciado también se redondea")
    void explicitParameters_shouldBeUsed() {
        SoundingTable table = tableWithDepth(5.0, 9.0, 1.0);

        SoundingTable result = adjuster.adjustDepth(table, 0.5, 0.0204);

        assertArrayEquals(new double[]{0.5, 0.52, 0.54}, result.getColumn(DEPTH), 1e-12);
    }

    @Test
    @DisplayName("Diferencias no numéricas se ignoran al promediar")
    void nanDifferences_shouldBeIgnored() {
        SoundingTable table = tableWithDepth(0.0, Double.NaN, 0.2, 0.3);

        SoundingTable result = adjuster.adjustDepth(table, null, null);

        assertEquals(0.3, result.getValue(DEPTH, 3), 1e-12);
    }

    @Test
    @DisplayName("Tabla vacía: error de datos")
    void emptyTable_shouldThrow() {
        assertThrows(InvalidDataException.class, () -> adjuster.adjustDepth(tableWithDepth(), null, 0.1));
    }

    @Test
    @DisplayName("Un único registro sin espaciado: error; con espaciado: válido")
    void singleRow_requiresSpacing() {
        SoundingTable single = tableWithDepth(3.0);

        assertThatThrownBy(() -> adjuster.adjustDepth(single, null, null))
                .isInstanceOf(InvalidDataException.class)
                .hasMessageContaining("espaciado");
        assertEquals(3.0, adjuster.adjustDepth(single, null, 0.02).getValue(DEPTH, 0));
    }

    @Test
    @DisplayName("Ninguna diferencia numérica: error de datos")
    void allDifferencesNaN_shouldThrow() {
        SoundingTable table = tableWithDepth(Double.NaN, Double.NaN, Double.NaN);

        assertThrows(InvalidDataException.class, () -> adjuster.adjustDepth(table, 0.0, null));
    }

    @Test
    @DisplayName("Redondeo de espaciado a milésimas")
    void roundToMillis_shouldRoundToThreeDecimals() {
        assertEquals(0.024, DepthAdjuster.roundToMillis(0.02351), 1e-15);
        assertEquals(-0.024, DepthAdjuster.roundToMillis(-0.02351), 1e-15);
        assertEquals(0.02, DepthAdjuster.roundToMillis(0.0204), 1e-15);
    }
}
