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

import java.util.HashMap;
import java.util.Map;
import java.util.Random;

import org.janelia.scanaug.util.TestImages;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the per-pixel filters ({@link BrightnessFilter}, {@link SubtleNoiseFilter}, {@link GrayscaleFilter}
 * and {@link DitheringFilter}).
 */
public class PixelFilterTest {

    @Test
    public void testBrightnessOnGrayscale() {
        final ImageProcessor result = new BrightnessFilter(1.5, 1.5).process(TestImages.constantGray(3, 3, 100),
                                                                             new Random(1));
        Assert.assertEquals("invalid scaled value", 150, result.get(1, 1));

        final ImageProcessor clamped = new BrightnessFilter(3.0, 3.0).process(TestImages.constantGray(3, 3, 100),
                                                                              new Random(1));
        Assert.assertEquals("scaled value should clamp", 255, clamped.get(1, 1));
    }

    @Test
    public void testBrightnessOnColor() {
        final ColorProcessor white = TestImages.constantColor(3, 3, 255, 255, 255);
        final ImageProcessor stillWhite = new BrightnessFilter(2.0, 2.0).process(white, new Random(1));
        Assert.assertEquals("white should stay white", 0xffffff, stillWhite.get(1, 1) & 0xffffff);

        final ColorProcessor gray = TestImages.constantColor(3, 3, 90, 90, 90);
        final ImageProcessor black = new BrightnessFilter(0.0, 0.0).process(gray, new Random(1));
        Assert.assertEquals("zero factor should give black", 0, black.get(1, 1) & 0xffffff);
    }

    @Test
    public void testSubtleNoiseStaysInRange() {
        final SubtleNoiseFilter filter = new SubtleNoiseFilter(3);

        final ImageProcessor result = filter.process(TestImages.constantGray(20, 20, 100), new Random(8));
        final ImageProcessor dark = filter.process(TestImages.constantGray(20, 20, 0), new Random(8));

        boolean changed = false;
        for (int i = 0; i < result.getPixelCount(); i++) {
            final int value = result.get(i);
            Assert.assertTrue("noisy value " + value + " out of range", (value >= 97) && (value <= 102));
            changed = changed || (value != 100);
            Assert.assertTrue("dark value should clamp at 0", dark.get(i) >= 0 && dark.get(i) <= 2);
        }
        Assert.assertTrue("noise should change some pixels", changed);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSubtleNoiseInvalidRange() {
        new SubtleNoiseFilter(0);
    }

    @Test
    public void testGrayscale() {
        final ColorProcessor source = TestImages.constantColor(4, 2, 10, 20, 30);

        final ImageProcessor singleChannel = new GrayscaleFilter(false).process(source, new Random(1));
        Assert.assertTrue("result should be single channel", singleChannel instanceof ByteProcessor);
        Assert.assertEquals("invalid luma", 18, singleChannel.get(2, 1));

        final ImageProcessor threeChannels = new GrayscaleFilter(true).process(source, new Random(1));
        Assert.assertTrue("result should keep three channels", threeChannels instanceof ColorProcessor);
        Assert.assertEquals("channels should be equal", (18 << 16) | (18 << 8) | 18, threeChannels.get(2, 1) & 0xffffff);

        final ByteProcessor gray = TestImages.constantGray(2, 2, 40);
        Assert.assertSame("grayscale input should pass through", gray, new GrayscaleFilter(true).process(gray, null));
    }

    @Test
    public void testDitheringFromParameters() {
        final Map<String, String> parameters = new HashMap<>();
        parameters.put("dither", "ordered");
        parameters.put("order", "1");
        final DitheringFilter filter = new DitheringFilter();
        filter.init(parameters);

        final ImageProcessor result = filter.process(TestImages.constantGray(2, 2, 128), new Random(1));
        Assert.assertEquals("invalid ordered value", 255, result.get(0, 0));
        Assert.assertEquals("invalid ordered value", 0, result.get(1, 0));

        parameters.put("dither", "floyd-steinberg");
        filter.init(parameters);
        final ImageProcessor diffused = filter.process(TestImages.constantGray(3, 3, 100), new Random(1));
        Assert.assertEquals("invalid diffused value", 0, diffused.get(1, 1));
    }

    @Test
    public void testDitheringDefaults() {
        final DitheringFilter filter = new DitheringFilter(DitheringFilter.DitherType.FLOYD_STEINBERG, 2);
        filter.init(new HashMap<>());
        Assert.assertEquals("invalid default type", DitheringFilter.DitherType.ORDERED, filter.getDitherType());
        Assert.assertEquals("invalid default order", DitheringFilter.DEFAULT_ORDER, filter.getOrder());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDitheringUnknownType() {
        final Map<String, String> parameters = new HashMap<>();
        parameters.put("dither", "atkinson");
        new DitheringFilter().init(parameters);
    }
}
