package projectconic.io;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;
import projectconic.config.SoundingConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Lee la configuración del procesado desde JSON y la valida.
 * <p>
 * La configuración se carga una sola vez y se pasa explícitamente a las
 * etapas; no hay estado global.
 */
@Slf4j
public class JsonConfigLoader {

    /** Recurso incluido en el classpath con los valores por defecto. */
    public static final String DEFAULT_RESOURCE = "/default-sounding-config.json";

    // Es costoso de crear y thread-safe: se reutiliza
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        return JsonMapper.builder()
                // Permite "replacement": NaN
                .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    /**
     * @param path Ruta del fichero JSON.
     * @return Configuración validada.
     * @throws IOException Si el fichero no existe, no puede leerse o no es JSON válido.
     * @throws projectconic.domain.exception.InvalidConfigurationException Si algún valor es inválido.
     */
    public SoundingConfig load(Path path) throws IOException {
        log.info("Cargando configuración desde {}", path.toAbsolutePath());
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException e) {
            log.error("Error al leer o parsear la configuración desde {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    public SoundingConfig load(InputStream in) throws IOException {
        SoundingConfig config = objectMapper.readValue(in, SoundingConfig.class);
        config.validate();
        log.debug("Configuración cargada: {}", config);
        return config;
    }

    /**
     * Configuración por defecto empaquetada con el motor.
     */
    public SoundingConfig loadDefault() throws IOException {
        try (InputStream in = JsonConfigLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IOException("Recurso de configuración no encontrado: " + DEFAULT_RESOURCE);
            }
            return load(in);
        }
    }
}
