package baromode.system;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

/**
 * Loads layered JSON configuration. Each configuration name maps to a file
 * named after it with '.' replaced by '_' and a ".json" extension. The
 * classpath copy is read first, then the copy in the directory named by the
 * {@link #CONFIG_DIR_PROPERTY} system property, if any, overwrites its keys.
 */
public abstract class Config
{
	/**
	 * System property naming a directory that holds configuration overrides
	 */
	public static final String CONFIG_DIR_PROPERTY = "baromode.configdir";


	/**
	 * Log4j Logger
	 */
	private static final Logger LOGGER = LogManager.getLogger(Config.class);


	/**
	 * Default constructor. Does nothing.
	 */
	private Config()
	{
	}


	/**
	 * Gets the configuration object for the given names. Later names overwrite
	 * the keys of earlier names.
	 *
	 * @param sConfigNames configuration names, usually fully qualified class
	 * names
	 * @return the merged configuration, empty if nothing was found
	 */
	public static JSONObject getConfig(String... sConfigNames)
	{
		JSONObject oConfig = new JSONObject();
		String sConfigDir = System.getProperty(CONFIG_DIR_PROPERTY);
		for (String sConfig : sConfigNames)
		{
			String sFilename = String.format("%s.json", sConfig.replace('.', '_'));
			InputStream oResource = Config.class.getResourceAsStream("/" + sFilename);
			if (oResource != null)
			{
				try (Reader oIn = new InputStreamReader(oResource, StandardCharsets.UTF_8))
				{
					merge(oConfig, oIn, sFilename);
				}
				catch (IOException oEx)
				{
					LOGGER.error(String.format("Failed to read configuration resource %s", sFilename), oEx);
				}
			}

			if (sConfigDir == null)
				continue;

			Path oFile = Paths.get(sConfigDir, sFilename);
			if (Files.exists(oFile))
			{
				try (BufferedReader oIn = Files.newBufferedReader(oFile, StandardCharsets.UTF_8))
				{
					merge(oConfig, oIn, oFile.toString());
				}
				catch (IOException oEx)
				{
					LOGGER.error(String.format("Failed to read configuration file %s", oFile), oEx);
				}
			}
		}
		return oConfig;
	}


	/**
	 * Parses a JSON object from the reader and copies its keys into the
	 * configuration object. A document that doesn't parse is logged and skipped.
	 */
	private static void merge(JSONObject oConfig, Reader oIn, String sSource)
	{
		try
		{
			JSONObject oOverWrite = new JSONObject(new JSONTokener(oIn));
			for (String sKey : oOverWrite.keySet())
				oConfig.put(sKey, oOverWrite.get(sKey));
		}
		catch (JSONException oEx)
		{
			LOGGER.error(String.format("Invalid configuration in %s, keeping previous values", sSource), oEx);
		}
	}
}
