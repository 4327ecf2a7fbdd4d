package projectconic.domain.sounding;

import java.util.List;

/**
 * Nombres canónicos de las columnas de una {@link SoundingTable}.
 * <p>
 * Las cabeceras del fichero de campo se traducen a estos nombres al cargar;
 * a partir de ahí todas las etapas trabajan con ellos.
 */
public final class SoundingColumns {

    // --- Entrada ---
    public static final String DEPTH = "depth";
    public static final String QC = "qc";
    public static final String FS = "fs";
    public static final String U2 = "u2";
    public static final String U0 = "u0";

    // --- Tensiones y normalización ---
    public static final String SIGMA_V_TOT = "sigma_v_tot";
    public static final String SIGMA_V_EFF = "sigma_v_eff";
    public static final String QT = "qt";
    public static final String FS_SMOOTHED = "fs_smoothed";
    public static final String QT_SMOOTHED = "qt_smoothed";
    public static final String FR = "Fr";
    public static final String BQ = "Bq";

    // --- Comportamiento del suelo ---
    public static final String N_EXPONENT = "n_exponent";
    public static final String QTN = "Qtn";
    public static final String IC = "Ic";
    public static final String CONVERGENCE_FLAG = "convergence_flag";
    public static final String CD = "Cd";
    public static final String IB = "Ib";

    /** Mínimo que debe traer cualquier fichero de entrada. */
    public static final List<String> REQUIRED_INPUT = List.of(DEPTH, QC, FS, U2);

    private SoundingColumns() {}
}
