package de.htwsaar.assetserver.common.serialization;

public class AssetSerializationException extends RuntimeException {

    public AssetSerializationException(String message) {

        super(message);
    }

    public AssetSerializationException(String message, Throwable cause) {

        super(message, cause);
    }
}
