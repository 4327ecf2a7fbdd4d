package projectconic.domain.exception;

import java.util.List;

/**
 * Columnas requeridas ausentes o contenido no numérico en una columna.
 * <p>
 * Cuando faltan columnas se informa de TODAS las ausentes, no sólo de la primera.
 */
public class SchemaException extends SoundingException {

    private final List<String> missingColumns;

    public SchemaException(String message) {
        super(message);
        this.missingColumns = List.of();
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
        this.missingColumns = List.of();
    }

    public SchemaException(List<String> missingColumns) {
        super("Faltan columnas requeridas: " + missingColumns);
        this.missingColumns = List.copyOf(missingColumns);
    }

    public static SchemaException missingColumn(String column) {
        return new SchemaException(List.of(column));
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }
}
