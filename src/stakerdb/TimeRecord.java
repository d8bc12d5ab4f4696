package stakerdb;

import java.util.TreeMap;
import java.util.Map;
import java.text.DecimalFormat;
import java.io.PrintStream;

public class TimeRecord
{
  private static final TimeRecord shared = new TimeRecord();

  private TreeMap<String, Long> times=new TreeMap<String, Long>();
  private TreeMap<String, Long> counts=new TreeMap<String, Long>();

  public static TimeRecord getShared()
  {
    return shared;
  }

  /**
   * Records the time since start_nanos (from System.nanoTime())
   * against name in the shared record
   */
  public static void record(long start_nanos, String name)
  {
    shared.addTime(System.nanoTime() - start_nanos, name);
  }

  public synchronized void addTime(long tm, String name)
  {
    Long prev = times.get(name);
    long p = 0;
    if (prev != null) p = prev;

    times.put(name, p + tm);

    Long c = counts.get(name);
    if (c == null) c = 0L;
    counts.put(name, c + 1);
  }

  public synchronized void printReport(PrintStream out)
  {
    DecimalFormat df = new DecimalFormat("0.000");

    for(Map.Entry<String, Long> me : times.entrySet())
    {
      String name = me.getKey();
      long nanosec = me.getValue();
      double seconds = nanosec / 1e9;
      out.println("  " + name + " - " + df.format(seconds) + " seconds (" + counts.get(name) + " calls)");
    }

  }

  public synchronized void reset()
  {
    times.clear();
    counts.clear();
  }


}
