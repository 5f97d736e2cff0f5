package com.adforge.core.scene;

/**
 * A visual reference for one scene.
 *
 * @param kind what the image shows
 * @param role composition role; subject references are composed before product references
 * @param url  image URL
 */
public record ReferenceImage(Kind kind, String role, String url) {

    public enum Kind { SUBJECT, PRODUCT }

    public static ReferenceImage subject(String url) {
        return new ReferenceImage(Kind.SUBJECT, "character", url);
    }

    public static ReferenceImage product(String url) {
        return new ReferenceImage(Kind.PRODUCT, "product", url);
    }
}
