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
package org.janelia.scanaug.filter;

import ij.process.ByteProcessor;
import ij.process.ColorProcessor;
import ij.process.ImageProcessor;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;

import org.janelia.scanaug.util.ImageProcessorUtil;

/**
 * Uses JPEG encoding to create compression artifacts in the image.
 * The image is encoded and decoded in memory with a quality drawn from the configured range.
 */
public class JpegFilter
        implements Filter {

    private int[] qualityRange;

    // empty constructor required to create instances from specifications
    @SuppressWarnings("unused")
    public JpegFilter() {
        this(25, 95);
    }

    public JpegFilter(final int minQuality,
                      final int maxQuality) {
        this.qualityRange = new int[] { minQuality, maxQuality };
        validate();
    }

    private void validate() {
        Filter.validateRange("qualityRange", qualityRange);
        if ((qualityRange[0] < 0) || (qualityRange[1] > 100)) {
            throw new IllegalArgumentException("'qualityRange' must be within [0, 100]");
        }
    }

    @Override
    public void init(final Map<String, String> params) {
        this.qualityRange = Filter.getIntegerArrayParameter("qualityRange", params, 2);
        validate();
    }

    @Override
    public Map<String, String> toParametersMap() {
        final Map<String, String> map = new LinkedHashMap<>();
        map.put("qualityRange", Filter.toParameterString(qualityRange));
        return map;
    }

    @Override
    public ImageProcessor process(final ImageProcessor ip,
                                  final Random random) {
        ImageProcessorUtil.validateEightBit(ip);
        final int quality = Filter.nextIntInclusive(random, qualityRange[0], qualityRange[1]);
        try {
            final byte[] encoded = encode(toBufferedImage(ip), quality / 100f);
            return fromBufferedImage(ImageIO.read(new ByteArrayInputStream(encoded)), ip);
        } catch (final IOException e) {
            throw new IllegalStateException("failed to JPEG encode and decode image with quality " + quality, e);
        }
    }

    static byte[] encode(final BufferedImage image,
                         final float quality)
            throws IOException {

        final Iterator<ImageWriter> writersForFormat = ImageIO.getImageWritersByFormatName("jpg");
        if ((writersForFormat == null) || (! writersForFormat.hasNext())) {
            throw new IOException("no JPEG image writer available");
        }

        final ImageWriter writer = writersForFormat.next();
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (final ImageOutputStream outputStream = ImageIO.createImageOutputStream(bytes)) {
            writer.setOutput(outputStream);
            final ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(quality);
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
        return bytes.toByteArray();
    }

    private static BufferedImage toBufferedImage(final ImageProcessor ip) {
        final int width = ip.getWidth();
        final int height = ip.getHeight();
        final BufferedImage image;
        if (ip instanceof ColorProcessor) {
            image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
            image.setRGB(0, 0, width, height, (int[]) ip.getPixels(), 0, width);
        } else {
            image = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
            image.getRaster().setDataElements(0, 0, width, height, ip.getPixels());
        }
        return image;
    }

    private static ImageProcessor fromBufferedImage(final BufferedImage decoded,
                                                    final ImageProcessor source)
            throws IOException {

        if (decoded == null) {
            throw new IOException("failed to decode JPEG data");
        }

        final int width = decoded.getWidth();
        final int height = decoded.getHeight();
        final ImageProcessor result;
        if (source instanceof ColorProcessor) {
            result = new ColorProcessor(width, height, decoded.getRGB(0, 0, width, height, null, 0, width));
        } else {
            final ByteProcessor bp = new ByteProcessor(width, height);
            final byte[] pixels = (byte[]) bp.getPixels();
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    pixels[y * width + x] = (byte) decoded.getRaster().getSample(x, y, 0);
                }
            }
            result = bp;
        }
        return result;
    }
}
