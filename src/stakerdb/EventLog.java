package stakerdb;

import java.io.PrintStream;
import java.io.FileOutputStream;
import java.io.OutputStream;

import java.text.SimpleDateFormat;


public class EventLog
{
    private boolean log_enabled=false;
    private PrintStream log_stream = null;
    private SimpleDateFormat sdf;

    public EventLog(Config conf)
        throws java.io.IOException
    {
        log_enabled = conf.getBoolean("event_log_enabled");

        if (log_enabled)
        {
            conf.require("event_log_path");
            log_stream = new PrintStream(new FileOutputStream(conf.get("event_log_path"), true));
        }
        sdf = new SimpleDateFormat("yyyy-MM-dd'T'HH:mm:ss.SSS");
    }

    public EventLog(OutputStream out)
    {
      log_stream = new PrintStream(out);
      log_enabled=true;
      sdf = new SimpleDateFormat("yyyy-MM-dd'T'HH:mm:ss.SSS");
    }

    public boolean isEnabled()
    {
      return log_enabled;
    }

    public void log(Throwable e)
    {
        log(e.toString());
    }

    public void logTrace(Throwable e)
    {
      if (!log_enabled) return;

      synchronized(log_stream)
      {
        log(e);
        e.printStackTrace(log_stream);
      }
    }

    public void log(String msg)
    {
        if (!log_enabled) return;

        synchronized(log_stream)
        {
            String line = formatLine(msg);
            log_stream.println(line);
            log_stream.flush();
        }
    }

    public void alarm(Throwable e)
    {
      alarm(e.toString());
    }

    /** Logs and also writes to stdout */
    public void alarm(String msg)
    {
      log(msg);
      System.out.println(formatLine(msg));
    }

    private String formatLine(String msg)
    {
      synchronized(sdf)
      {
        return sdf.format(new java.util.Date()) + " - " + msg;
      }
    }

}
