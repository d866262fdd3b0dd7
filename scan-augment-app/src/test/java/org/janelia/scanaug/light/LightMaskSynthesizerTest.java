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
package org.janelia.scanaug.light;

import ij.process.ByteProcessor;

import java.awt.Point;
import java.util.Random;

import org.janelia.scanaug.util.ImageProcessorUtil;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link LightMaskSynthesizer} class.
 */
public class LightMaskSynthesizerTest {

    @Test
    public void testRandomMaskSize() {
        final LightMaskSynthesizer synthesizer = new LightMaskSynthesizer();
        for (final DecayMode mode : DecayMode.values()) {
            final ByteProcessor mask = new LightMaskSynthesizer(255, 0, mode, null).generate(31, 17, new Random(3));
            Assert.assertEquals("invalid width for " + mode, 31, mask.getWidth());
            Assert.assertEquals("invalid height for " + mode, 17, mask.getHeight());
        }
        Assert.assertEquals("invalid default mode", DecayMode.GAUSSIAN, synthesizer.getMode());
    }

    @Test
    public void testConstantGaussianIsInverted() {
        final LightMaskSynthesizer synthesizer = new LightMaskSynthesizer(100, 100, DecayMode.GAUSSIAN, null);
        final ByteProcessor mask = synthesizer.generate(24, 16, new Point(5, 5), 30.0, new Random(1));

        for (int i = 0; i < mask.getPixelCount(); i++) {
            Assert.assertEquals("invalid value at " + i, 155, mask.get(i));
        }
    }

    @Test
    public void testFullTurnMatchesNoRotation() {
        final LightMaskSynthesizer synthesizer = new LightMaskSynthesizer(255, 0, DecayMode.GAUSSIAN, null);
        final Point position = new Point(10, 8);

        final ByteProcessor unrotated = synthesizer.generate(32, 24, position, 0.0, new Random(7));
        final ByteProcessor fullTurn = synthesizer.generate(32, 24, position, 360.0, new Random(7));

        Assert.assertTrue("0 and 360 degrees should produce the same mask",
                          ImageProcessorUtil.hasSamePixels(unrotated, fullTurn));
    }

    @Test
    public void testHorizontalStripIsDarkestAtLightRow() {
        final LightMaskSynthesizer synthesizer = new LightMaskSynthesizer(255, 0, DecayMode.GAUSSIAN, null);
        final ByteProcessor mask = synthesizer.generate(40, 60, new Point(20, 30), 0.0, new Random(5));

        // light rows are inverted to the darkest values
        Assert.assertTrue("light row should be darker than the top row", mask.get(20, 30) < mask.get(20, 0));
        Assert.assertEquals("rows should be constant without rotation", mask.get(5, 30), mask.get(35, 30));
    }

    @Test
    public void testQuarterTurnGivesVerticalStrip() {
        final LightMaskSynthesizer synthesizer = new LightMaskSynthesizer(255, 0, DecayMode.LINEAR_STATIC, 10.0);
        final ByteProcessor mask = synthesizer.generate(40, 30, new Point(20, 15), 90.0, new Random(5));

        for (int x = 0; x < mask.getWidth(); x++) {
            final int top = mask.get(x, 0);
            for (int y = 1; y < mask.getHeight(); y++) {
                Assert.assertEquals("column " + x + " should be constant at row " + y, top, mask.get(x, y), 1);
            }
        }

        final int lightColumn = mask.get(20, 15);
        for (int x = 0; x < mask.getWidth(); x++) {
            Assert.assertTrue("light column should be darkest, column " + x + " is darker",
                              lightColumn <= mask.get(x, 15) + 1);
        }
        Assert.assertTrue("far column should be brighter", mask.get(0, 15) > lightColumn + 30);
    }

    @Test
    public void testEighthTurnRotatesCounterClockwise() {
        final LightMaskSynthesizer synthesizer = new LightMaskSynthesizer(255, 0, DecayMode.LINEAR_STATIC, 10.0);
        final ByteProcessor mask = synthesizer.generate(40, 40, new Point(20, 20), 45.0, new Random(5));

        // the strip runs from lower left to upper right, so (25, 15) lies on it and (25, 25) lies
        // (5 + 5) / sqrt(2) rows away from it
        final int atLight = mask.get(20, 20);
        final int onStrip = mask.get(25, 15);
        final int offStrip = mask.get(25, 25);

        Assert.assertEquals("point on the strip should match the light", atLight, onStrip, 3);
        Assert.assertTrue("point across the strip should be brighter, light " + atLight + ", off strip " + offStrip,
                          offStrip > atLight + 30);
        Assert.assertEquals("point mirrored along the strip should match", onStrip, mask.get(15, 25), 3);
    }

    @Test
    public void testLinearDynamicDecay() {
        final LightMaskSynthesizer synthesizer = new LightMaskSynthesizer(255, 0, DecayMode.LINEAR_DYNAMIC, null);
        final ByteProcessor mask = synthesizer.generate(50, 50, new Point(25, 10), 0.0, new Random(9));

        Assert.assertTrue("mask should be darker near the light", mask.get(25, 10) < mask.get(25, 45));
    }

    @Test
    public void testLinearStaticUsesConfiguredRate() {
        final LightMaskSynthesizer synthesizer = new LightMaskSynthesizer(255, 0, DecayMode.LINEAR_STATIC, 3.0);
        final DecayModel model = synthesizer.buildDecayModel(10, 10, new Random(1));
        Assert.assertTrue("invalid model type", model instanceof DecayModel.Linear);
        Assert.assertEquals("invalid rate", 3.0, ((DecayModel.Linear) model).getDecayRate(), 0.0);
    }

    @Test
    public void testLinearStaticRandomRate() {
        final LightMaskSynthesizer synthesizer = new LightMaskSynthesizer(255, 0, DecayMode.LINEAR_STATIC, null);
        for (long seed = 0; seed < 20; seed++) {
            final DecayModel.Linear model = (DecayModel.Linear) synthesizer.buildDecayModel(10, 10, new Random(seed));
            final double rate = model.getDecayRate();
            Assert.assertTrue("rate " + rate + " out of range",
                              (rate >= LightMaskSynthesizer.MIN_RANDOM_DECAY_RATE) &&
                              (rate < LightMaskSynthesizer.MAX_RANDOM_DECAY_RATE));
        }
    }

    @Test
    public void testNormalizeDegrees() {
        Assert.assertEquals(0.0, LightMaskSynthesizer.normalizeDegrees(360.0), 0.0);
        Assert.assertEquals(90.0, LightMaskSynthesizer.normalizeDegrees(450.0), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMinAboveMax() {
        new LightMaskSynthesizer(100, 200, DecayMode.GAUSSIAN, null);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBrightnessOutOfRange() {
        new LightMaskSynthesizer(300, 0, DecayMode.GAUSSIAN, null);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidSize() {
        new LightMaskSynthesizer().generate(0, 10, new Random(1));
    }
}
