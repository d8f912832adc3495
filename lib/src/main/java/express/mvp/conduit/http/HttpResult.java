package express.mvp.conduit.http;

/**
 * Status and body of a completed HTTP exchange.
 *
 * @param status the HTTP status code
 * @param body the response body, empty when the server sent none
 */
public record HttpResult(int status, String body) {

    public HttpResult {
        body = body != null ? body : "";
    }

    /**
     * Checks for a 2xx status.
     *
     * @return true on success
     */
    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
