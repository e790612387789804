///////////////////////////////////////////////////////////////////////////////
// For information as to what this class does, see the Javadoc, below.       //
// Copyright (C) 2026 by the Archy contributors.                             //
//                                                                           //
// This program is free software; you can redistribute it and/or modify      //
// it under the terms of the GNU General Public License as published by      //
// the Free Software Foundation; either version 2 of the License, or         //
// (at your option) any later version.                                       //
//                                                                           //
// This program is distributed in the hope that it will be useful,           //
// but WITHOUT ANY WARRANTY; without even the implied warranty of            //
// MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the             //
// GNU General Public License for more details.                              //
//                                                                           //
// You should have received a copy of the GNU General Public License         //
// along with this program; if not, write to the Free Software               //
// Foundation, Inc., 59 Temple Place, Suite 330, Boston, MA  02111-1307  USA //
///////////////////////////////////////////////////////////////////////////////

package io.github.archy.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Stores named parameters for the engines. Values set explicitly take precedence; anything not set
 * falls back to the defaults in <code>archy-defaults.properties</code> on the classpath.
 */
public class Parameters {

    public static final String VERBOSE = "verbose";
    public static final String DEFAULT_ERROR_TERM = "defaultErrorTerm";
    public static final String MISSING_VALUE = "missingValue";
    public static final String MAX_PATH_LENGTH = "maxPathLength";

    private static final String DEFAULTS_RESOURCE = "/archy-defaults.properties";
    private static final Properties DEFAULTS = loadDefaults();

    private final Map<String, Object> parameters = new HashMap<>();

    public Parameters() {
    }

    public Parameters(Parameters parameters) {
        this.parameters.putAll(parameters.parameters);
    }

    public boolean getBoolean(String name) {
        Object value = getValue(name);
        return value instanceof Boolean ? (Boolean) value : Boolean.parseBoolean(value.toString());
    }

    public int getInt(String name) {
        Object value = getValue(name);
        return value instanceof Number ? ((Number) value).intValue() : Integer.parseInt(value.toString().trim());
    }

    public double getDouble(String name) {
        Object value = getValue(name);
        return value instanceof Number ? ((Number) value).doubleValue() : Double.parseDouble(value.toString().trim());
    }

    public Parameters set(String name, Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Value for " + name + " may not be null.");
        }

        parameters.put(name, value);
        return this;
    }

    /**
     * @return the names of all parameters that have a value, explicit or default.
     */
    public Set<String> getParametersNames() {
        Set<String> names = new TreeSet<>(DEFAULTS.stringPropertyNames());
        names.addAll(parameters.keySet());
        return names;
    }

    private Object getValue(String name) {
        Object value = parameters.get(name);

        if (value == null) {
            value = DEFAULTS.getProperty(name);
        }

        if (value == null) {
            throw new IllegalArgumentException("No value or default for parameter: " + name);
        }

        return value;
    }

    private static Properties loadDefaults() {
        Properties properties = new Properties();

        try (InputStream in = Parameters.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing resource " + DEFAULTS_RESOURCE);
            }

            properties.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Could not read " + DEFAULTS_RESOURCE, e);
        }

        return properties;
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder("Parameters:");

        for (String name : getParametersNames()) {
            buf.append("\n").append(name).append(" = ").append(getValue(name));
        }

        return buf.toString();
    }
}
