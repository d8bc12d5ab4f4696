package stakerdb;

import java.io.FileInputStream;
import java.io.IOException;
import java.util.Properties;

/**
 * Simple key/value configuration backed by a java properties file.
 */
public class Config
{
  private Properties props;

  public Config(String file_name)
    throws IOException
  {
    props = new Properties();
    try(FileInputStream in = new FileInputStream(file_name))
    {
      props.load(in);
    }
  }

  public Config(Properties props)
  {
    this.props = props;
  }

  public void require(String key)
  {
    if (!isSet(key))
    {
      throw new RuntimeException("Missing required config key: " + key);
    }
  }

  public boolean isSet(String key)
  {
    return props.getProperty(key) != null;
  }

  public String get(String key)
  {
    String v = props.getProperty(key);
    if (v == null) return null;
    return v.trim();
  }

  public String get(String key, String default_value)
  {
    if (!isSet(key)) return default_value;
    return get(key);
  }

  public boolean getBoolean(String key)
  {
    if (!isSet(key)) return false;
    return Boolean.parseBoolean(get(key));
  }

  public int getInt(String key)
  {
    require(key);
    return Integer.parseInt(get(key));
  }

  public int getInt(String key, int default_value)
  {
    if (!isSet(key)) return default_value;
    return getInt(key);
  }

}
