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

import ij.process.ImageProcessor;

import java.io.Serializable;
import java.util.Random;

import org.janelia.scanaug.util.ImageProcessorUtil;

/**
 * A {@link Filter} gated by the probability that it is applied to any given image.
 * <p>
 * When the gate fails (and the stage is not forced) the input image is passed through unchanged,
 * so stages always compose.  The filter only ever sees a duplicate of its input.
 */
public class TransformStage
        implements Serializable {

    private final Filter filter;
    private final double probability;

    public TransformStage(final Filter filter) {
        this(filter, 1.0);
    }

    /**
     * @param  filter       filter to apply.
     * @param  probability  probability that the filter is applied to an image.
     *
     * @throws IllegalArgumentException
     *   if the filter is null or the probability is outside [0, 1].
     */
    public TransformStage(final Filter filter,
                          final double probability)
            throws IllegalArgumentException {
        if (filter == null) {
            throw new IllegalArgumentException("filter must be defined");
        }
        if (! ((probability >= 0.0) && (probability <= 1.0))) {
            throw new IllegalArgumentException("probability " + probability + " must be between 0 and 1");
        }
        this.filter = filter;
        this.probability = probability;
    }

    public Filter getFilter() {
        return filter;
    }

    public double getProbability() {
        return probability;
    }

    public String getName() {
        return filter.getClass().getSimpleName();
    }

    /**
     * Stages with a probability of 0 or 1 do not draw from the generator,
     * so they leave the random stream of later stages untouched.
     *
     * @return true if a uniform draw from the specified generator falls below this stage's probability.
     */
    public boolean shouldRun(final Random random) {
        return (probability >= 1.0) || ((probability > 0.0) && (random.nextDouble() < probability));
    }

    /**
     * @return filtered image or the (unmodified) input if this stage was skipped.
     */
    public ImageProcessor apply(final ImageProcessor image,
                                final Random random) {
        return run(image, false, random).getImage();
    }

    /**
     * @return filtered image or the (unmodified) input if this stage was skipped.
     */
    public ImageProcessor apply(final ImageProcessor image,
                                final boolean force,
                                final Random random) {
        return run(image, force, random).getImage();
    }

    /**
     * @param  image   image to process (never modified).
     * @param  force   if true, apply the filter regardless of this stage's probability.
     * @param  random  source for the gate draw and all filter draws.
     *
     * @return output of this stage.
     *
     * @throws IllegalArgumentException
     *   if the image is not an 8-bit grayscale or RGB image.
     */
    public StageOutput run(final ImageProcessor image,
                           final boolean force,
                           final Random random)
            throws IllegalArgumentException {

        ImageProcessorUtil.validateEightBit(image);

        final StageOutput output;
        if (force || shouldRun(random)) {
            final ImageProcessor result = filter.process(image.duplicate(), random);
            output = new StageOutput(getName(), true, result);
        } else {
            output = new StageOutput(getName(), false, image);
        }
        return output;
    }

    @Override
    public String toString() {
        return getName() + "(p=" + probability + ", " + filter.toParametersMap() + ")";
    }
}
