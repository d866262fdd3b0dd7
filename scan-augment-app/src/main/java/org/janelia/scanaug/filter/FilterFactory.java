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

import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.janelia.scanaug.json.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maintains a mapping of configured stage list names to filter specifications and
 * facilitates constructing the corresponding {@link AugmentationSequence} instances.
 */
public class FilterFactory implements Serializable {

    public static final String SCANNER_LIST_NAME = "scanner";

    private final Map<String, List<FilterSpec>> namedFilterSpecLists;

    /**
     * Constructs an empty factory.
     */
    public FilterFactory() {
        this.namedFilterSpecLists = new HashMap<>();
    }

    /**
     *
     * @param  name  name of the desired filter list.
     *
     * @return list of filter specifications associated with the specified name.
     *
     * @throws IllegalArgumentException
     *   if no list with the specified name exists.
     */
    public List<FilterSpec> getFilterList(final String name)
            throws IllegalArgumentException {

        final List<FilterSpec> filterSpecs = namedFilterSpecLists.get(name);

        if (filterSpecs == null) {
            throw new IllegalArgumentException("Filter list with name '" + name + "' not found.  " +
                                               "This could be caused by usage of an incorrect name or " +
                                               "by a problem with the system filter configuration file " +
                                               getSystemConfigurationFile() + ".");
        }

        return filterSpecs;
    }

    public Set<String> getFilterListNames() {
        return new TreeSet<>(namedFilterSpecLists.keySet());
    }

    /**
     * Adds the specified list to this factory.
     *
     * @param  name      name of the list.
     * @param  specList  specifications in the list.
     */
    public void addFilterList(final String name,
                              final List<FilterSpec> specList) {
        namedFilterSpecLists.put(name, specList);
    }

    /**
     * @param  name  name of the desired filter list.
     *
     * @return sequence of stages built from the named list.
     *
     * @throws IllegalArgumentException
     *   if the list does not exist or any of its stages cannot be built.
     */
    public AugmentationSequence buildSequence(final String name)
            throws IllegalArgumentException {
        return new AugmentationSequence(buildStageList(getFilterList(name)));
    }

    /**
     * @return a JSON representation of this factory.
     */
    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    /**
     * @return a factory instance parsed from the system configuration file, the bundled
     *         configuration resource if the system file does not exist, or an empty factory
     *         instance if neither can be parsed.
     */
    public static FilterFactory loadConfiguredInstance() {

        FilterFactory factory = new FilterFactory();

        final File configFile = getSystemConfigurationFile();

        if (configFile.exists()) {
            try (final Reader reader = new FileReader(configFile)) {
                factory = fromJson(reader);

                LOG.info("loadConfiguredInstance: loaded {} named filter lists from {}",
                         factory.namedFilterSpecLists.size(), configFile);

            } catch (final Throwable t) {
                LOG.warn("loadConfiguredInstance: failed to load filters from " + configFile +
                         ", named filter lists will not be supported", t);
            }

        } else {
            try (final InputStream stream = FilterFactory.class.getResourceAsStream(BUNDLED_CONFIGURATION)) {
                if (stream == null) {
                    LOG.warn("loadConfiguredInstance: failed to find {} or bundled {}, named filter lists will not be supported",
                             configFile, BUNDLED_CONFIGURATION);
                } else {
                    factory = JSON_HELPER.fromJson(stream);
                    LOG.info("loadConfiguredInstance: loaded {} named filter lists from bundled {}",
                             factory.namedFilterSpecLists.size(), BUNDLED_CONFIGURATION);
                }
            } catch (final IOException | IllegalArgumentException e) {
                LOG.warn("loadConfiguredInstance: failed to load bundled " + BUNDLED_CONFIGURATION +
                         ", named filter lists will not be supported", e);
            }
        }

        return factory;
    }

    /**
     * @param  reader  reader to parse.
     *
     * @return a factory instance populated by parsing the specified json reader's stream.
     */
    public static FilterFactory fromJson(final Reader reader) {
        return JSON_HELPER.fromJson(reader);
    }

    /**
     * @return default list of stages simulating a physically scanned page.
     */
    public static List<TransformStage> buildDefaultStageList() {
        return new ArrayList<>(Arrays.asList(
                new TransformStage(new LightingShadowFilter(), 0.5),
                new TransformStage(new BrightnessFilter(0.8, 1.4), 0.5),
                new TransformStage(new SubtleNoiseFilter(5)),
                new TransformStage(new GrayscaleFilter(true)),
                new TransformStage(new JpegFilter(50, 95), 0.5)));
    }

    /**
     * @param  specList  list of filter specifications.
     *
     * @return list of stages built from the specifications.
     */
    public static List<TransformStage> buildStageList(final List<FilterSpec> specList) {
        final List<TransformStage> stageList = new ArrayList<>(specList.size());
        //noinspection Convert2streamapi
        for (final FilterSpec spec : specList) {
            stageList.add(spec.buildStage());
        }
        return stageList;
    }

    private static final Logger LOG = LoggerFactory.getLogger(FilterFactory.class);

    private static final String BUNDLED_CONFIGURATION = "/filter_lists.json";

    private static final JsonUtils.Helper<FilterFactory> JSON_HELPER =
            new JsonUtils.Helper<>(FilterFactory.class);

    private static File getSystemConfigurationFile() {
        return new File("resources/filter_lists.json").getAbsoluteFile();
    }
}
