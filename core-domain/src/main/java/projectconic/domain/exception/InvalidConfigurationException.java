package projectconic.domain.exception;

/**
 * Valor de configuración inválido. Es fatal y se detecta antes de procesar
 * ninguna fila.
 */
public class InvalidConfigurationException extends InvalidDataException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
