package de.bsommerfeld.recall.db;

import de.bsommerfeld.recall.core.error.ErrorKind;
import de.bsommerfeld.recall.core.error.MemoryException;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.sql.SQLException;

/**
 * Maps driver exceptions onto {@link ErrorKind}s. SQLite reports constraint
 * failures only through the message text, busy and locked conditions also
 * through the (possibly extended) result code.
 */
final class SqlErrors {

    private static final String UNIQUE_VIOLATION = "UNIQUE constraint failed";
    private static final String FOREIGN_KEY_VIOLATION = "FOREIGN KEY constraint failed";
    private static final String LOCKED = "database is locked";

    private SqlErrors() {
    }

    static MemoryException translate(String action, SQLException e) {
        if (isUniqueViolation(e)) {
            return new MemoryException(ErrorKind.ALREADY_EXISTS, action + ": already exists", e);
        }
        if (isForeignKeyViolation(e)) {
            return new MemoryException(ErrorKind.NOT_FOUND, action + ": referenced record does not exist", e);
        }
        if (isBusy(e)) {
            return new MemoryException(ErrorKind.UNAVAILABLE, action + ": database is busy", e);
        }
        return new MemoryException(ErrorKind.INTERNAL, action + ": " + e.getMessage(), e);
    }

    static boolean isUniqueViolation(SQLException e) {
        return messageContains(e, UNIQUE_VIOLATION);
    }

    static boolean isForeignKeyViolation(SQLException e) {
        return messageContains(e, FOREIGN_KEY_VIOLATION);
    }

    static boolean isBusy(SQLException e) {
        if (e instanceof SQLiteException) {
            int primary = ((SQLiteException) e).getResultCode().code & 0xFF;
            if (primary == SQLiteErrorCode.SQLITE_BUSY.code || primary == SQLiteErrorCode.SQLITE_LOCKED.code) {
                return true;
            }
        }
        return messageContains(e, LOCKED) || messageContains(e, "SQLITE_BUSY");
    }

    private static boolean messageContains(SQLException e, String fragment) {
        return e.getMessage() != null && e.getMessage().contains(fragment);
    }
}
