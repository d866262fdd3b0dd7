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
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link ImageProcessorUtil} class.
 */
public class ImageProcessorUtilTest {

    @Test
    public void testSplitAndMergeColorChannels() {
        final ColorProcessor source = TestImages.constantColor(3, 2, 10, 20, 30);

        final ByteProcessor[] channels = ImageProcessorUtil.splitChannels(source);
        Assert.assertEquals("invalid number of channels", 3, channels.length);
        Assert.assertEquals("invalid red value", 10, channels[0].get(1, 1));
        Assert.assertEquals("invalid green value", 20, channels[1].get(1, 1));
        Assert.assertEquals("invalid blue value", 30, channels[2].get(1, 1));

        final ImageProcessor merged = ImageProcessorUtil.mergeChannels(channels);
        Assert.assertTrue("merged image should be color", merged instanceof ColorProcessor);
        Assert.assertTrue("merged pixels should match source", ImageProcessorUtil.hasSamePixels(source, merged));
    }

    @Test
    public void testMapChannelsDoesNotModifySource() {
        final ByteProcessor source = TestImages.constantGray(4, 4, 77);

        final ImageProcessor mapped = ImageProcessorUtil.mapChannels(source, channel -> {
            channel.invert();
            return channel;
        });

        Assert.assertEquals("source should not be modified", 77, source.get(2, 2));
        Assert.assertEquals("mapped value should be inverted", 255 - 77, mapped.get(2, 2));
    }

    @Test
    public void testClampToByte() {
        Assert.assertEquals("negative values should clamp to 0", 0, ImageProcessorUtil.clampToByte(-3.2));
        Assert.assertEquals("large values should clamp to 255", 255, ImageProcessorUtil.clampToByte(300));
        Assert.assertEquals("fractions should truncate", 12, ImageProcessorUtil.clampToByte(12.9));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnsupportedImageType() {
        ImageProcessorUtil.validateEightBit(new FloatProcessor(2, 2));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMergeUnsupportedChannelCount() {
        ImageProcessorUtil.mergeChannels(new ByteProcessor[] { new ByteProcessor(1, 1), new ByteProcessor(1, 1) });
    }
}
