package projectconic.domain.exception;

/**
 * Datos que no permiten ejecutar una etapa (tabla vacía, filas insuficientes
 * para inferir el espaciado, etc.).
 */
public class InvalidDataException extends SoundingException {

    public InvalidDataException(String message) {
        super(message);
    }
}
