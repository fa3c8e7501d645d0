package com.deckinverter.util;

import org.apache.poi.sl.usermodel.PictureData.PictureType;

/**
 * Encodings the image transformer writes.
 */
public enum ImageFormat {
    /** Lossless, keeps transparency. */
    LOSSLESS_PNG("png", PictureType.PNG),
    /** Lossy, used for fully opaque images. */
    LOSSY_JPEG("jpeg", PictureType.JPEG);

    private final String imageIoName;
    private final PictureType pictureType;

    ImageFormat(String imageIoName, PictureType pictureType) {
        this.imageIoName = imageIoName;
        this.pictureType = pictureType;
    }

    public String getImageIoName() {
        return imageIoName;
    }

    public PictureType getPictureType() {
        return pictureType;
    }
}
