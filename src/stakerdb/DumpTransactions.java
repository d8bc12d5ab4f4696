package stakerdb;

import java.io.PrintStream;

/**
 * Prints stored transactions as JSON, one per line.
 *
 * Usage: DumpTransactions config_file [reversed] [withdrawable best_height]
 */
public class DumpTransactions
{
  private static void usage()
  {
    System.out.println("Usage: DumpTransactions config_file [reversed] [withdrawable best_height]");
    System.exit(-1);
  }

  public static void main(String args[]) throws Exception
  {
    if (args.length < 1) usage();

    boolean reversed = false;
    Integer best_height = null;

    int i = 1;
    if (i < args.length && args[i].equals("reversed"))
    {
      reversed = true;
      i++;
    }
    if (i < args.length)
    {
      if (!args[i].equals("withdrawable") || i + 2 != args.length) usage();
      best_height = Integer.parseInt(args[i + 1]);
    }

    StakerDB stakerdb = new StakerDB(new Config(args[0]));
    try
    {
      long count = dump(stakerdb, best_height, reversed, System.out);
      System.err.println("Dumped " + count + " of " + stakerdb.getStore().getTransactionCount() + " transactions");
      TimeRecord.getShared().printReport(System.err);
    }
    finally
    {
      stakerdb.close();
    }
  }

  /**
   * Walks the whole store a page at a time, pages as large as the config allows.
   * Each page is printed in ascending order, so a reversed dump prints
   * the last page first.
   * @param best_height if not null only withdrawable transactions are printed
   * @return number printed
   */
  public static long dump(StakerDB stakerdb, Integer best_height, boolean reversed, PrintStream out)
    throws StakerDBException
  {
    TrackedTransactionStore store = stakerdb.getStore();
    PageParams.Limits limits = stakerdb.getPageLimits();
    long offset = 0L;
    long count = 0L;

    while(true)
    {
      PageParams page = PageParams.of(offset, (long) limits.getMaxLimit(), limits);
      StoredTransactionQuery q = page.toQuery(reversed);
      if (best_height != null) q = q.withdrawable(best_height);

      StoredTransactionQueryResult res = store.queryStoredTransactions(q);

      for(StoredTransaction tx : res.getTransactions())
      {
        out.println(new StakingDetails(tx, stakerdb.getNetworkParameters()).toJSON());
        count++;
      }

      if (!res.hasNextPage()) break;
      offset = res.getNextOffset();
    }
    out.flush();
    return count;
  }

}
