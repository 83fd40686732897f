package com.automate.ImageScan.util;

import com.automate.ImageScan.exception.InvalidImageReferenceException;

public final class ImageReferences {

    /** Width of {@code scans.image}. */
    public static final int MAX_LENGTH = 512;

    private ImageReferences() {}

    /**
     * Returns the trimmed reference, the form that is scanned and stored.
     *
     * @throws InvalidImageReferenceException when nothing is left after trimming, or it is too long to store
     */
    public static String requireValid(String image) {
        if (image == null || image.isBlank()) {
            throw new InvalidImageReferenceException("Image name is required");
        }
        String trimmed = image.trim();
        if (trimmed.length() > MAX_LENGTH) {
            throw new InvalidImageReferenceException("Image name must be at most " + MAX_LENGTH + " characters");
        }
        return trimmed;
    }
}
