package dev.pekelund.invoicebatch.upload;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Maps failures to the user-facing {@link UploadErrorCategory}. Pure and stateless.
 */
public final class UploadErrorClassifier {

    private static final int MAX_CAUSE_DEPTH = 10;

    private static final Pattern TIMEOUT = Pattern.compile("timed? ?out|timeout");
    private static final Pattern NETWORK =
        Pattern.compile("network|connection|connect failed|unreachable|unknown host|socket");
    private static final Pattern PERMISSION =
        Pattern.compile("unauthori[sz]ed|forbidden|permission|access denied|\\b401\\b|\\b403\\b");
    private static final Pattern TOO_LARGE = Pattern.compile("too large|file size|size limit|\\b413\\b");
    private static final Pattern FORMAT = Pattern.compile("unsupported|format|invalid|\\b415\\b");
    private static final Pattern DUPLICATE = Pattern.compile("duplicate|already (been )?uploaded");
    private static final Pattern SERVER =
        Pattern.compile("server|unavailable|\\b500\\b|\\b502\\b|\\b503\\b|\\b504\\b");

    private UploadErrorClassifier() {
    }

    public static UploadErrorCategory categorize(UploadFailureKind kind, Throwable error) {
        if (kind == UploadFailureKind.CANCELLED_FAILURE) {
            return UploadErrorCategory.CANCELLED;
        }

        UploadErrorCategory hint = categoryHint(error);
        if (hint != null) {
            return hint;
        }

        if (kind == UploadFailureKind.TIMEOUT_FAILURE || isTimeout(error)) {
            return UploadErrorCategory.NETWORK;
        }

        UploadErrorCategory byType = categorizeByType(error);
        if (byType != null) {
            return byType;
        }

        for (Throwable current = error; current != null; current = current.getCause()) {
            UploadErrorCategory byMessage = keywordCategory(current.getMessage());
            if (byMessage != null) {
                return byMessage;
            }
        }

        if (kind == UploadFailureKind.EXTRACTION_FAILURE) {
            return UploadErrorCategory.EXTRACTION_FAILURE;
        }
        return UploadErrorCategory.UNKNOWN;
    }

    /**
     * Keyword heuristic on a raw error string, falling back to {@link UploadErrorCategory#UNKNOWN}.
     */
    public static UploadErrorCategory categorize(String rawMessage) {
        UploadErrorCategory category = keywordCategory(rawMessage);
        return category != null ? category : UploadErrorCategory.UNKNOWN;
    }

    public static String displayMessage(UploadFailureKind kind, Throwable error) {
        return categorize(kind, error).displayMessage();
    }

    public static UploadErrorCategory categorizeStatus(int statusCode) {
        if (statusCode == 401 || statusCode == 403) {
            return UploadErrorCategory.PERMISSION_DENIED;
        }
        if (statusCode == 413) {
            return UploadErrorCategory.FILE_TOO_LARGE;
        }
        if (statusCode == 415) {
            return UploadErrorCategory.UNSUPPORTED_FORMAT;
        }
        if (statusCode == 408 || statusCode == 504) {
            return UploadErrorCategory.NETWORK;
        }
        if (statusCode >= 500 && statusCode < 600) {
            return UploadErrorCategory.SERVER_ERROR;
        }
        return null;
    }

    public static boolean isTimeout(Throwable error) {
        int depth = 0;
        for (Throwable current = error; current != null && depth < MAX_CAUSE_DEPTH; current = current.getCause()) {
            if (current instanceof SocketTimeoutException
                || current instanceof TimeoutException
                || current instanceof HttpTimeoutException) {
                return true;
            }
            depth++;
        }
        return false;
    }

    private static UploadErrorCategory categoryHint(Throwable error) {
        int depth = 0;
        for (Throwable current = error; current != null && depth < MAX_CAUSE_DEPTH; current = current.getCause()) {
            if (current instanceof UploadStageException stageException && stageException.getCategory() != null) {
                return stageException.getCategory();
            }
            depth++;
        }
        return null;
    }

    private static UploadErrorCategory categorizeByType(Throwable error) {
        int depth = 0;
        for (Throwable current = error; current != null && depth < MAX_CAUSE_DEPTH; current = current.getCause()) {
            if (current instanceof RestClientResponseException responseException) {
                UploadErrorCategory category = categorizeStatus(responseException.getStatusCode().value());
                if (category != null) {
                    return category;
                }
            }
            if (current instanceof ResourceAccessException
                || current instanceof ConnectException
                || current instanceof NoRouteToHostException
                || current instanceof UnknownHostException) {
                return UploadErrorCategory.NETWORK;
            }
            depth++;
        }
        return null;
    }

    private static UploadErrorCategory keywordCategory(String rawMessage) {
        if (rawMessage == null || rawMessage.isBlank()) {
            return null;
        }
        String message = rawMessage.toLowerCase(Locale.ROOT);
        if (TIMEOUT.matcher(message).find() || NETWORK.matcher(message).find()) {
            return UploadErrorCategory.NETWORK;
        }
        if (PERMISSION.matcher(message).find()) {
            return UploadErrorCategory.PERMISSION_DENIED;
        }
        if (SERVER.matcher(message).find()) {
            return UploadErrorCategory.SERVER_ERROR;
        }
        if (TOO_LARGE.matcher(message).find()) {
            return UploadErrorCategory.FILE_TOO_LARGE;
        }
        if (FORMAT.matcher(message).find()) {
            return UploadErrorCategory.UNSUPPORTED_FORMAT;
        }
        if (DUPLICATE.matcher(message).find()) {
            return UploadErrorCategory.DUPLICATE;
        }
        return null;
    }
}
