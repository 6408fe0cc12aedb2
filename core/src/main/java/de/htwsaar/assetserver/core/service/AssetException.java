package de.htwsaar.assetserver.core.service;

/**
 * Fachliche Exception beim Auflösen eines Assets.
 * Wird im Web-Layer in HTTP-Statuscodes gemappt.
 */
public abstract class AssetException extends RuntimeException {

    private final int statusCode;

    protected AssetException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * Gibt den zugehörigen HTTP-Statuscode zurück.
     *
     * @return HTTP-Statuscode
     */
    public int getStatusCode() {
        return statusCode;
    }
}
