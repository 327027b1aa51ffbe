package com.techlab.mailmerge.renderer;

/** A logo or signature that is not a decodable base64 data URI. */
public class AssetDecodeException extends RenderException {

    public AssetDecodeException(String message) {
        super(message);
    }

    public AssetDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
