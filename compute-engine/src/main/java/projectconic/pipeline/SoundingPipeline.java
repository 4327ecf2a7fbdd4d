package projectconic.pipeline;

import lombok.extern.slf4j.Slf4j;
import projectconic.config.SoundingConfig;
import projectconic.domain.exception.SoundingException;
import projectconic.domain.sounding.SoundingTable;
import projectconic.io.SoundingCsvReader;
import projectconic.physics.solver.BehaviorSolver;
import projectconic.physics.solver.StressSolver;
import projectconic.physics.solver.impl.CorrectedStressSolver;
import projectconic.physics.solver.impl.RobertsonBehaviorSolver;
import projectconic.processing.DepthAdjuster;
import projectconic.processing.SentinelCleaner;

import java.io.IOException;
import java.nio.file.Path;
import java.util.function.Supplier;

/**
 * Orquestador del procesado de un sondeo CPTu.
 * <p>
 * Ejecuta las etapas en secuencia estricta, cada una sobre la tabla completa
 * producida por la anterior:
 * <ol>
 * <li>Carga y validación del fichero.</li>
 * <li>Limpieza de registros con códigos centinela.</li>
 * <li>Regularización de la profundidad (opcional).</li>
 * <li>Tensiones y ratios normalizados.</li>
 * <li>Índice de comportamiento del suelo.</li>
 * </ol>
 * Las etapas son puras: si una falla se aborta el resto y no queda ningún
 * estado intermedio. La configuración se valida al construir el orquestador,
 * antes de tocar ningún dato.
 */
@Slf4j
public class SoundingPipeline {

    private final SoundingConfig config;
    private final SoundingCsvReader reader;
    private final SentinelCleaner cleaner;
    private final DepthAdjuster depthAdjuster;
    private final StressSolver stressSolver;
    private final BehaviorSolver behaviorSolver;

    public SoundingPipeline(SoundingConfig config) {
        this(config, new SoundingCsvReader(), new SentinelCleaner(), new DepthAdjuster(),
                new CorrectedStressSolver(), new RobertsonBehaviorSolver());
    }

    public SoundingPipeline(SoundingConfig config,
                            SoundingCsvReader reader,
                            SentinelCleaner cleaner,
                            DepthAdjuster depthAdjuster,
                            StressSolver stressSolver,
                            BehaviorSolver behaviorSolver) {
        this.config = config.validate();
        this.reader = reader;
        this.cleaner = cleaner;
        this.depthAdjuster = depthAdjuster;
        this.stressSolver = stressSolver;
        this.behaviorSolver = behaviorSolver;
        log.info("SoundingPipeline inicializado. (Limpieza: {}, Ajuste de profundidad: {}, Ventana: {}, Solver: {})",
                config.getCleaning().getMode(), config.getDepthAdjustment().isEnabled(),
                config.getRollingWindow(), behaviorSolver.getName());
    }

    /**
     * Carga el fichero y ejecuta todas las etapas.
     *
     * @throws IOException Si el fichero no puede leerse.
     */
    public SoundingTable process(Path source) throws IOException {
        long startTime = System.currentTimeMillis();
        SoundingTable raw;
        try {
            raw = reader.read(source, config);
        } catch (SoundingException e) {
            log.warn("Etapa 'carga' fallida: {}", e.getMessage());
            throw e;
        }
        SoundingTable result = process(raw);
        log.info("Sondeo {} procesado en {} ms", source.getFileName(), System.currentTimeMillis() - startTime);
        return result;
    }

    /**
     * Ejecuta las etapas 2 a 5 sobre una tabla ya cargada.
     */
    public SoundingTable process(SoundingTable raw) {
        SoundingTable cleaned = runStage("limpieza", raw, () -> clean(raw));

        SoundingTable adjusted = cleaned;
        SoundingConfig.DepthAdjustmentConfig depthConfig = config.getDepthAdjustment();
        if (depthConfig.isEnabled()) {
            adjusted = runStage("ajuste de profundidad", cleaned, () -> depthAdjuster.adjustDepth(
                    cleaned, depthConfig.getStartDepth(), depthConfig.getSpacing()));
        }

        final SoundingTable depthReady = adjusted;
        SoundingTable stresses = runStage("tensiones", depthReady,
                () -> stressSolver.computeStresses(depthReady, config));

        return runStage("comportamiento", stresses,
                () -> behaviorSolver.solveBehavior(stresses, config));
    }

    SoundingTable clean(SoundingTable table) {
        SoundingConfig.CleaningConfig cleaning = config.getCleaning();
        double[] indicators = cleaning.indicatorValues();
        return switch (cleaning.getMode()) {
            case REMOVE -> cleaner.removeRows(table, indicators);
            case REPLACE -> cleaner.replaceRows(table, indicators, cleaning.getReplacement());
            case REMOVE_INCOMPLETE -> cleaner.removeIncompleteRows(table, indicators);
            case NONE -> table;
        };
    }

    private SoundingTable runStage(String stage, SoundingTable input, Supplier<SoundingTable> step) {
        log.debug("Etapa '{}' iniciada con {} registros", stage, input.getRowCount());
        try {
            SoundingTable output = step.get();
            log.info("Etapa '{}' completada: {} -> {} registros", stage, input.getRowCount(), output.getRowCount());
            return output;
        } catch (SoundingException e) {
            log.warn("Etapa '{}' fallida, se aborta el procesado: {}", stage, e.getMessage());
            throw e;
        }
    }

    public SoundingConfig getConfig() {
        return config;
    }
}
