package org.janelia.calibration.loader;

import ij.ImagePlus;
import ij.io.Opener;
import ij.process.FloatProcessor;

/**
 * Uses ImageJ to load images as float pixels.
 *
 * @author Eric Trautman
 */
public class ImageLoader {

    /**
     * @return float pixels of the image at the specified path (or file URL).
     *
     * @throws IllegalArgumentException
     *   if the image cannot be loaded.
     */
    public FloatProcessor load(final String urlString)
            throws IllegalArgumentException {

        // openers keep state about the file being opened, so we need to create a new opener for each load
        final Opener opener = new Opener();
        opener.setSilentMode(true);

        String path = urlString;
        if (urlString.startsWith("file:")) {
            path = urlString.substring(5);
        }

        final ImagePlus imagePlus;
        try {
            imagePlus = opener.openImage(path);
        } catch (final Throwable t) {
            throw new IllegalArgumentException(getErrorMessage(urlString), t);
        }

        if (imagePlus == null) {
            throw new IllegalArgumentException(getErrorMessage(urlString));
        }

        return imagePlus.getProcessor().convertToFloatProcessor();
    }

    private String getErrorMessage(final String urlString) {
        return "failed to create imagePlus instance for '" + urlString + "'";
    }
}
