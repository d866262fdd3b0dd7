/**
 * License: GPL
 *
 * This program is free software; you can redistribute it and/or
 * modify it under the terms of the GNU General Public License 2
 * as published by the Free Software Foundation.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program; if not, write to the Free Software
 * Foundation, Inc., 59 Temple Place - Suite 330, Boston, MA  02111-1307, USA.
 */
package org.janelia.scanaug.util;

import ij.process.ByteProcessor;
import ij.process.ColorProcessor;
import ij.process.ImageProcessor;

import java.util.function.UnaryOperator;

/**
 * Utility methods for working with 8-bit grayscale ({@link ByteProcessor}) and
 * 3-channel RGB ({@link ColorProcessor}) images.
 */
public class ImageProcessorUtil {

    /**
     * @throws IllegalArgumentException
     *   if the specified processor is not an 8-bit grayscale or RGB processor.
     */
    public static void validateEightBit(final ImageProcessor ip)
            throws IllegalArgumentException {
        if (ip == null) {
            throw new IllegalArgumentException("image must be defined");
        }
        if (! (ip instanceof ByteProcessor) && ! (ip instanceof ColorProcessor)) {
            throw new IllegalArgumentException("unsupported image type " + ip.getClass().getSimpleName() +
                                               ", only 8-bit grayscale and RGB images can be processed");
        }
    }

    /**
     * @return number of 8-bit channels in the specified processor.
     */
    public static int getChannelCount(final ImageProcessor ip) {
        validateEightBit(ip);
        return (ip instanceof ColorProcessor) ? 3 : 1;
    }

    /**
     * @return independent copies of each channel (red, green, blue for color images).
     */
    public static ByteProcessor[] splitChannels(final ImageProcessor ip) {
        validateEightBit(ip);

        final int width = ip.getWidth();
        final int height = ip.getHeight();
        final ByteProcessor[] channels;

        if (ip instanceof ColorProcessor) {
            final int pixelCount = width * height;
            final byte[] red = new byte[pixelCount];
            final byte[] green = new byte[pixelCount];
            final byte[] blue = new byte[pixelCount];
            ((ColorProcessor) ip).getRGB(red, green, blue);
            channels = new ByteProcessor[] {
                    new ByteProcessor(width, height, red),
                    new ByteProcessor(width, height, green),
                    new ByteProcessor(width, height, blue)
            };
        } else {
            channels = new ByteProcessor[] {
                    new ByteProcessor(width, height, ((byte[]) ip.getPixels()).clone())
            };
        }

        return channels;
    }

    /**
     * @return new processor built from the specified channels
     *         (a {@link ColorProcessor} for three channels, a {@link ByteProcessor} for one).
     */
    public static ImageProcessor mergeChannels(final ByteProcessor[] channels)
            throws IllegalArgumentException {

        final ImageProcessor merged;
        if (channels.length == 1) {
            merged = channels[0];
        } else if (channels.length == 3) {
            final ColorProcessor cp = new ColorProcessor(channels[0].getWidth(), channels[0].getHeight());
            cp.setRGB((byte[]) channels[0].getPixels(),
                      (byte[]) channels[1].getPixels(),
                      (byte[]) channels[2].getPixels());
            merged = cp;
        } else {
            throw new IllegalArgumentException("cannot merge " + channels.length + " channels");
        }
        return merged;
    }

    /**
     * Applies the specified operation to each channel of the image independently.
     * The source image is not modified.
     *
     * @return new image assembled from the processed channels.
     */
    public static ImageProcessor mapChannels(final ImageProcessor ip,
                                             final UnaryOperator<ByteProcessor> channelOperation) {
        final ByteProcessor[] channels = splitChannels(ip);
        for (int c = 0; c < channels.length; c++) {
            channels[c] = channelOperation.apply(channels[c]);
        }
        return mergeChannels(channels);
    }

    /**
     * @return pixel values of the specified 8-bit plane as floats (for lossless accumulation).
     */
    public static float[] toFloatArray(final ByteProcessor bp) {
        final byte[] pixels = (byte[]) bp.getPixels();
        final float[] values = new float[pixels.length];
        for (int i = 0; i < pixels.length; i++) {
            values[i] = pixels[i] & 0xff;
        }
        return values;
    }

    /**
     * @return value clamped to the 8-bit range.
     */
    public static int clampToByte(final double value) {
        if (value < 0) {
            return 0;
        } else if (value > 255) {
            return 255;
        }
        return (int) value;
    }

    /**
     * @return true if every pixel of every channel of the two images matches.
     */
    public static boolean hasSamePixels(final ImageProcessor a,
                                        final ImageProcessor b) {
        if ((a.getWidth() != b.getWidth()) || (a.getHeight() != b.getHeight()) ||
            (getChannelCount(a) != getChannelCount(b))) {
            return false;
        }
        final int pixelCount = a.getPixelCount();
        for (int i = 0; i < pixelCount; i++) {
            if ((a.get(i) & 0x00ffffff) != (b.get(i) & 0x00ffffff)) {
                return false;
            }
        }
        return true;
    }

    private ImageProcessorUtil() {
    }
}
