package com.e2eq.attribute.util;

import com.e2eq.attribute.exceptions.AttributeAdminException;
import com.e2eq.attribute.exceptions.ErrorCode;
import io.quarkus.logging.Log;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Consistent exception logging for the attribute API. Client errors are logged without stack
 * traces; server side failures with them.
 */
public final class ExceptionLoggingUtils {

    private ExceptionLoggingUtils() {
    }

    /**
     * Logs at the level the error code deserves: ERROR with stack trace for internal errors,
     * WARN for refused writes, DEBUG for plain client mistakes.
     */
    public static void logByCode(AttributeAdminException exception, String context) {
        ErrorCode code = exception.getCode();
        switch (code) {
            case INTERNAL_ERROR:
                logError(exception, context);
                break;
            case CONFLICT:
            case FORBIDDEN:
            case CONSTRAINT_VIOLATION:
                Log.warnf("%s: [%s] %s", context, code, exception.getMessage());
                break;
            default:
                if (Log.isDebugEnabled()) {
                    Log.debugf("%s: [%s] %s", context, code, exception.getMessage());
                }
        }
    }

    public static void logError(Throwable exception, String message, Object... args) {
        String formatted = args.length > 0 ? String.format(message, args) : message;
        if (exception == null) {
            Log.error(formatted);
            return;
        }
        Log.errorf("%s: %s%n%s", formatted, describe(exception), getStackTrace(exception));
    }

    public static void logWarn(Throwable exception, String message, Object... args) {
        String formatted = args.length > 0 ? String.format(message, args) : message;
        if (exception == null) {
            Log.warn(formatted);
            return;
        }
        Log.warnf("%s: %s", formatted, describe(exception));
    }

    public static void logDebug(Throwable exception, String message, Object... args) {
        if (!Log.isDebugEnabled()) {
            return;
        }
        String formatted = args.length > 0 ? String.format(message, args) : message;
        if (exception == null) {
            Log.debug(formatted);
            return;
        }
        Log.debugf("%s: %s%n%s", formatted, describe(exception), getStackTrace(exception));
    }

    public static String getStackTrace(Throwable exception) {
        if (exception == null) {
            return "";
        }
        StringWriter sw = new StringWriter();
        PrintWriter pw = new PrintWriter(sw);
        exception.printStackTrace(pw);
        return sw.toString();
    }

    private static String describe(Throwable exception) {
        return exception.getMessage() != null ? exception.getMessage() : exception.getClass().getName();
    }
}
