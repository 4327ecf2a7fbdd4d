package projectconic.domain.exception;

/**
 * Raíz de la jerarquía de errores del procesado de sondeos.
 * <p>
 * Los valores numéricos degenerados (NaN, infinitos) y la no convergencia del
 * solver NO son errores: se registran en la tabla como resultados válidos.
 */
public abstract class SoundingException extends RuntimeException {

    protected SoundingException(String message) {
        super(message);
    }

    protected SoundingException(String message, Throwable cause) {
        super(message, cause);
    }
}
