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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;

import org.janelia.scanaug.util.ImageProcessorUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds a list of {@link TransformStage}s to be applied in sequence (first to last),
 * feeding the output of each stage to the next.
 * <p>
 * Every invocation builds its own stage output log, so one instance can be reused across images and threads.
 * A sequence is itself a {@link Filter} and can therefore be nested as a stage of another sequence,
 * in which case only its final image is forwarded.
 */
public class AugmentationSequence
        implements Filter {

    private List<TransformStage> stages;

    // empty constructor required to create instances from specifications
    @SuppressWarnings("unused")
    public AugmentationSequence() {
        this(new ArrayList<>());
    }

    public AugmentationSequence(final TransformStage... stages) {
        this(Arrays.asList(stages));
    }

    public AugmentationSequence(final List<TransformStage> stages) {
        this.stages = new ArrayList<>(stages);
    }

    public List<TransformStage> getStages() {
        return Collections.unmodifiableList(stages);
    }

    @Override
    public void init(final Map<String, String> params) {
        final List<TransformStage> parsedStages = new ArrayList<>(params.size());
        for (int i = 0; params.containsKey(stageKey(i)); i++) {
            final FilterSpec filterSpec = FilterSpec.fromJson(params.get(stageKey(i)));
            parsedStages.add(filterSpec.buildStage());
        }

        if (parsedStages.size() != params.size()) {
            final Set<String> unexpectedKeys = new TreeSet<>(params.keySet());
            for (int i = 0; i < parsedStages.size(); i++) {
                unexpectedKeys.remove(stageKey(i));
            }
            throw new IllegalArgumentException("unexpected parameters " + unexpectedKeys +
                                               ", stages must be keyed stage0, stage1, ... without gaps");
        }

        stages = parsedStages;
    }

    @Override
    public Map<String, String> toParametersMap() {
        final Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < stages.size(); i++) {
            final FilterSpec filterSpec = FilterSpec.forStage(stages.get(i));
            map.put(stageKey(i), filterSpec.toJson());
        }
        return map;
    }

    private static String stageKey(final int i) {
        return "stage" + i;
    }

    /**
     * Applies all stages using a newly seeded random number generator.
     */
    public SequenceResult apply(final ImageProcessor image) {
        return apply(image, new Random());
    }

    /**
     * Applies all stages using a generator with the specified seed (for reproducible results).
     */
    public SequenceResult apply(final ImageProcessor image,
                                final long seed) {
        return apply(image, new Random(seed));
    }

    /**
     * @param  image   image to augment (never modified).
     * @param  random  source for all gate and filter draws.
     *
     * @return final image (a copy of the input when every stage was skipped) and the output of every stage.
     *
     * @throws IllegalArgumentException
     *   if the image is not an 8-bit grayscale or RGB image.
     */
    public SequenceResult apply(final ImageProcessor image,
                                final Random random)
            throws IllegalArgumentException {

        ImageProcessorUtil.validateEightBit(image);

        final List<StageOutput> stageOutputs = new ArrayList<>(stages.size());
        ImageProcessor result = image;
        for (final TransformStage stage : stages) {
            final StageOutput output = stage.run(result, false, random);
            LOG.debug("apply: {}", output);
            stageOutputs.add(output);
            result = output.getImage();
        }

        // the result is never the caller's instance
        if (result == image) {
            result = image.duplicate();
        }

        return new SequenceResult(result, stageOutputs);
    }

    @Override
    public ImageProcessor process(final ImageProcessor ip,
                                  final Random random) {
        return apply(ip, random).getImage();
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("AugmentationSequence([\n");
        for (final TransformStage stage : stages) {
            sb.append('\t').append(stage).append(",\n");
        }
        return sb.append("])").toString();
    }

    private static final Logger LOG = LoggerFactory.getLogger(AugmentationSequence.class);
}
