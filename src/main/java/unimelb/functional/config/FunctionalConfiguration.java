/*
 * Copyright 2019 Zoey Hewll
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package unimelb.functional.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Simple wrapper for using Properties() loaded from the {@value #RESOURCE} classpath resource.
 * Every value has a default, used when the resource or the key is missing.
 */
public final class FunctionalConfiguration
{
    private static final Logger log = Logger.getLogger(FunctionalConfiguration.class.getName());

    public static final String RESOURCE = "functional.properties";

    static final String UNKNOWN_ERROR_MESSAGE_KEY = "try.unknownErrorMessage";
    static final String LOG_CAPTURED_FAILURES_KEY = "try.logCapturedFailures";

    static final String DEFAULT_UNKNOWN_ERROR_MESSAGE = "An unknown error was thrown, error = ";
    static final boolean DEFAULT_LOG_CAPTURED_FAILURES = true;

    private static String unknownErrorMessage = DEFAULT_UNKNOWN_ERROR_MESSAGE;
    private static boolean logCapturedFailures = DEFAULT_LOG_CAPTURED_FAILURES;

    private static boolean initialised = false;

    // private constructor to prevent initialization
    private FunctionalConfiguration() {}

    private static synchronized void ensureLoaded()
    {
        if (!initialised)
        {
            load(loadProperties());
            initialised = true;
        }
    }

    private static Properties loadProperties()
    {
        Properties properties = new Properties();
        try (InputStream inputStream = FunctionalConfiguration.class.getClassLoader().getResourceAsStream(RESOURCE))
        {
            if (inputStream == null)
            {
                log.fine("No " + RESOURCE + " on the classpath, using defaults");
                return properties;
            }
            properties.load(inputStream);
            log.fine("Loaded configuration from " + RESOURCE);
        }
        catch (IOException e)
        {
            log.log(Level.WARNING, "Failed reading " + RESOURCE + ", using defaults", e);
        }
        return properties;
    }

    /**
     * Replaces the current values with the ones found in the given properties.
     * Keys that are missing or malformed fall back to their defaults.
     *
     * @param properties the source of configuration values
     */
    public static synchronized void load(Properties properties)
    {
        unknownErrorMessage = properties.getProperty(UNKNOWN_ERROR_MESSAGE_KEY, DEFAULT_UNKNOWN_ERROR_MESSAGE);

        String logFailures = properties.getProperty(LOG_CAPTURED_FAILURES_KEY);
        if (logFailures == null)
        {
            logCapturedFailures = DEFAULT_LOG_CAPTURED_FAILURES;
        }
        else if (logFailures.trim().equalsIgnoreCase("true") || logFailures.trim().equalsIgnoreCase("false"))
        {
            logCapturedFailures = Boolean.parseBoolean(logFailures.trim());
        }
        else
        {
            log.warning("Config entry \"" + LOG_CAPTURED_FAILURES_KEY + "\" formatted incorrectly: not a valid boolean: "
                    + logFailures);
            logCapturedFailures = DEFAULT_LOG_CAPTURED_FAILURES;
        }
        initialised = true;
    }

    /**
     * Reloads the values from the classpath resource.
     */
    public static synchronized void reload()
    {
        initialised = false;
        ensureLoaded();
    }

    /**
     * The prefix of the message given to a throwable which is not an {@link Exception} when it is captured.
     */
    public static synchronized String getUnknownErrorMessage()
    {
        ensureLoaded();
        return unknownErrorMessage;
    }

    /**
     * Whether failures captured by {@code Try} are logged at {@code FINE}.
     */
    public static synchronized boolean isLogCapturedFailures()
    {
        ensureLoaded();
        return logCapturedFailures;
    }
}
