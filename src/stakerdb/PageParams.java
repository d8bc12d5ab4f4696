package stakerdb;

/**
 * Offset and limit as given by a caller, before they become a query.
 * Missing values take the defaults and the limit is capped.
 */
public class PageParams
{
  public static class Limits
  {
    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 100;

    private final int default_limit;
    private final int max_limit;

    public Limits(int default_limit, int max_limit)
    {
      if (default_limit < 0 || max_limit < 0)
      {
        throw new IllegalArgumentException("Page limits can't be negative");
      }
      if (default_limit > max_limit)
      {
        throw new IllegalArgumentException("Default page limit " + default_limit + " is above max " + max_limit);
      }
      this.default_limit = default_limit;
      this.max_limit = max_limit;
    }

    public static Limits fromConfig(Config config)
    {
      return new Limits(
        config.getInt("query_default_limit", DEFAULT_LIMIT),
        config.getInt("query_max_limit", MAX_LIMIT));
    }

    public int getDefaultLimit(){ return default_limit; }
    public int getMaxLimit(){ return max_limit; }
  }

  private final long offset;
  private final long limit;

  private PageParams(long offset, long limit)
  {
    this.offset = offset;
    this.limit = limit;
  }

  /**
   * @param offset null for 0
   * @param limit null for the default, anything over the max is cut to the max
   * @throws IllegalArgumentException on negative values
   */
  public static PageParams of(Long offset, Long limit, Limits limits)
  {
    long o = 0L;
    if (offset != null)
    {
      if (offset < 0) throw new IllegalArgumentException("Negative offset: " + offset);
      o = offset;
    }

    long l = limits.getDefaultLimit();
    if (limit != null)
    {
      if (limit < 0) throw new IllegalArgumentException("Negative limit: " + limit);
      l = Math.min(limit, limits.getMaxLimit());
    }

    return new PageParams(o, l);
  }

  public long getOffset(){ return offset; }
  public long getLimit(){ return limit; }

  public StoredTransactionQuery toQuery(boolean reversed)
  {
    return new StoredTransactionQuery(offset, limit, reversed);
  }

  @Override
  public String toString()
  {
    return "offset=" + offset + " limit=" + limit;
  }
}
