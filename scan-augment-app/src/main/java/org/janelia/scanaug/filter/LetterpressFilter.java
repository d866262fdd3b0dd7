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
import ij.process.ImageProcessor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

import org.janelia.scanaug.util.ImageProcessorUtil;

/**
 * Produces regions of ink mimicking the effect of ink pressed unevenly onto paper.
 * <p>
 * Clusters of gaussian distributed points are drawn into a noise mask which replaces
 * every channel sample darker than a (random) threshold.
 */
public class LetterpressFilter
        implements Filter {

    public static final double DEFAULT_BLUR_SIGMA = 1.1;

    private int[] samplesRange;
    private int[] clustersRange;
    private int[] stdRange;
    private int[] valueRange;
    private int[] valueThresholdRange;
    private boolean blur;

    // empty constructor required to create instances from specifications
    @SuppressWarnings("unused")
    public LetterpressFilter() {
        this(new int[] { 300, 800 },
             new int[] { 300, 800 },
             new int[] { 1500, 5000 },
             new int[] { 200, 255 },
             new int[] { 128, 128 },
             true);
    }

    /**
     * @param  samplesRange         range for the number of points in each cluster.
     * @param  clustersRange        range for the number of clusters in each batch.
     * @param  stdRange             range for the cluster standard deviation (in hundredths of a pixel).
     * @param  valueRange           range for the mask value of each point.
     * @param  valueThresholdRange  range for the threshold below which samples are replaced.
     * @param  blur                 blur the noise mask before applying it.
     */
    public LetterpressFilter(final int[] samplesRange,
                             final int[] clustersRange,
                             final int[] stdRange,
                             final int[] valueRange,
                             final int[] valueThresholdRange,
                             final boolean blur) {
        this.samplesRange = samplesRange;
        this.clustersRange = clustersRange;
        this.stdRange = stdRange;
        this.valueRange = valueRange;
        this.valueThresholdRange = valueThresholdRange;
        this.blur = blur;
        validate();
    }

    private void validate() {
        Filter.validateRange("samplesRange", samplesRange);
        Filter.validateRange("clustersRange", clustersRange);
        Filter.validateRange("stdRange", stdRange);
        Filter.validateRange("valueRange", valueRange);
        if ((samplesRange[0] < 0) || (clustersRange[0] < 0) || (stdRange[0] < 0)) {
            throw new IllegalArgumentException("sample, cluster and std ranges must not be negative");
        }
        if ((valueRange[0] < 0) || (valueRange[1] > 255)) {
            throw new IllegalArgumentException("'valueRange' must be within [0, 255]");
        }
    }

    @Override
    public void init(final Map<String, String> params) {
        this.samplesRange = Filter.getIntegerArrayParameter("samplesRange", params, 2);
        this.clustersRange = Filter.getIntegerArrayParameter("clustersRange", params, 2);
        this.stdRange = Filter.getIntegerArrayParameter("stdRange", params, 2);
        this.valueRange = Filter.getIntegerArrayParameter("valueRange", params, 2);
        this.valueThresholdRange = Filter.getIntegerArrayParameter("valueThresholdRange", params, 2);
        this.blur = Filter.getBooleanParameter("blur", params);
        validate();
    }

    @Override
    public Map<String, String> toParametersMap() {
        final Map<String, String> map = new LinkedHashMap<>();
        map.put("samplesRange", Filter.toParameterString(samplesRange));
        map.put("clustersRange", Filter.toParameterString(clustersRange));
        map.put("stdRange", Filter.toParameterString(stdRange));
        map.put("valueRange", Filter.toParameterString(valueRange));
        map.put("valueThresholdRange", Filter.toParameterString(valueThresholdRange));
        map.put("blur", String.valueOf(blur));
        return map;
    }

    @Override
    public ImageProcessor process(final ImageProcessor ip,
                                  final Random random) {

        ImageProcessorUtil.validateEightBit(ip);

        final ByteProcessor noiseMask = buildNoiseMask(ip.getWidth(), ip.getHeight(), random);
        if (blur) {
            noiseMask.blurGaussian(DEFAULT_BLUR_SIGMA);
        }

        // a reversed threshold range falls back to its upper bound
        final int valueThreshold = valueThresholdRange[1] >= valueThresholdRange[0] ?
                                   Filter.nextIntInclusive(random, valueThresholdRange[0], valueThresholdRange[1]) :
                                   valueThresholdRange[1];

        final byte[] maskPixels = (byte[]) noiseMask.getPixels();
        return ImageProcessorUtil.mapChannels(ip, channel -> {
            final byte[] pixels = (byte[]) channel.getPixels();
            for (int i = 0; i < pixels.length; i++) {
                if ((pixels[i] & 0xff) < valueThreshold) {
                    pixels[i] = maskPixels[i];
                }
            }
            return channel;
        });
    }

    ByteProcessor buildNoiseMask(final int width,
                                 final int height,
                                 final Random random) {

        final ByteProcessor noiseMask = new ByteProcessor(width, height);
        final byte[] maskPixels = (byte[]) noiseMask.getPixels();
        final int maxBoxSize = Math.max(width, height);

        final int batchCount = Filter.nextIntInclusive(random, 8, 12);
        for (int batch = 0; batch < batchCount; batch++) {

            final int clusterCount = Filter.nextIntInclusive(random, clustersRange[0], clustersRange[1]);
            final double std = Filter.nextIntInclusive(random, stdRange[0], stdRange[1]) / 100.0;

            for (int cluster = 0; cluster < clusterCount; cluster++) {
                final int sampleCount = Filter.nextIntInclusive(random, samplesRange[0], samplesRange[1]);
                final double centerY = random.nextDouble() * maxBoxSize;
                final double centerX = random.nextDouble() * maxBoxSize;

                for (int sample = 0; sample < sampleCount; sample++) {
                    final int y = (int) (centerY + random.nextGaussian() * std);
                    final int x = (int) (centerX + random.nextGaussian() * std);
                    // points outside of the image are dropped
                    if ((x >= 0) && (x < width) && (y >= 0) && (y < height)) {
                        maskPixels[y * width + x] =
                                (byte) Filter.nextIntInclusive(random, valueRange[0], valueRange[1]);
                    }
                }
            }
        }

        return noiseMask;
    }
}
