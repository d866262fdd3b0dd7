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

import java.util.LinkedHashMap;
import java.util.Map;

import org.janelia.scanaug.json.JsonUtils;

/**
 * Specifies a {@link Filter} implementation along with its parameters and
 * the probability that it is applied when built as a {@link TransformStage}.
 */
public class FilterSpec {

    private final String className;
    private final Map<String, String> parameters;
    private final Double probability;

    private transient Class<?> clazz;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private FilterSpec() {
        this.className = null;
        this.parameters = null;
        this.probability = null;
    }

    public FilterSpec(final String className,
                      final Map<String, String> parameters) {
        this(className, parameters, null);
    }

    /**
     * Full constructor.
     *
     * @param  className    name of filter implementation (java) class, simple names are resolved
     *                      relative to this package.
     * @param  parameters   data with which filter implementation should be initialized.
     * @param  probability  probability that the filter is applied (null for always).
     */
    public FilterSpec(final String className,
                      final Map<String, String> parameters,
                      final Double probability) {
        this.className = className;
        this.parameters = parameters;
        this.probability = probability;
    }

    public String getClassName() {
        return className;
    }

    public Map<String, String> getParameters() {
        return parameters;
    }

    public double getProbability() {
        return probability == null ? 1.0 : probability;
    }

    /**
     * @return instance of this filter initialized with the specified parameters.
     *
     * @throws IllegalArgumentException
     *   if an instance cannot be created for any reason.
     */
    public Filter buildInstance()
            throws IllegalArgumentException {

        final Class<?> clazz = getClazz();
        final Object instance;
        try {
            instance = clazz.getDeclaredConstructor().newInstance();
        } catch (final Exception e) {
            throw new IllegalArgumentException("failed to create instance of filter class '" + className + "'", e);
        }

        final Filter filter;
        if (instance instanceof Filter) {
            filter = (Filter) instance;
        } else {
            throw new IllegalArgumentException("class '" + className + "' does not implement the '" +
                                               Filter.class + "' interface");
        }

        filter.init(parameters == null ? new LinkedHashMap<>() : parameters);

        return filter;
    }

    /**
     * @return probability gated stage for this filter.
     *
     * @throws IllegalArgumentException
     *   if the filter cannot be created or the probability is invalid.
     */
    public TransformStage buildStage()
            throws IllegalArgumentException {
        return new TransformStage(buildInstance(), getProbability());
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    @Override
    public String toString() {
        return toJson();
    }

    public static FilterSpec fromJson(final String json) {
        return JSON_HELPER.fromJson(json);
    }

    /**
     * @param  filter  instance to convert to a specification.
     *
     * @return specification for the filter instance.
     */
    public static FilterSpec forFilter(final Filter filter) {
        return new FilterSpec(filter.getClass().getName(), filter.toParametersMap());
    }

    /**
     * @param  stage  stage to convert to a specification.
     *
     * @return specification for the stage's filter and probability.
     */
    public static FilterSpec forStage(final TransformStage stage) {
        final Filter filter = stage.getFilter();
        return new FilterSpec(filter.getClass().getName(), filter.toParametersMap(), stage.getProbability());
    }

    private Class<?> getClazz() throws IllegalArgumentException {
        if (clazz == null) {
            if (className == null) {
                throw new IllegalArgumentException("no className defined for filter spec");
            }
            final String qualifiedName = className.indexOf('.') < 0 ?
                                         FilterSpec.class.getPackage().getName() + "." + className :
                                         className;
            try {
                clazz = Class.forName(qualifiedName);
            } catch (final ClassNotFoundException e) {
                throw new IllegalArgumentException("filter class '" + className + "' cannot be found", e);
            }
        }
        return clazz;
    }

    private static final JsonUtils.Helper<FilterSpec> JSON_HELPER =
            new JsonUtils.Helper<>(FilterSpec.class);
}
