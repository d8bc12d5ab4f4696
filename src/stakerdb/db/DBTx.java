package stakerdb.db;

/**
 * A read-only snapshot view or a read-write unit of work.
 * Only valid inside the DBAction it was handed to.
 */
public abstract class DBTx
{
  private final boolean read_only;

  protected DBTx(boolean read_only)
  {
    this.read_only = read_only;
  }

  public boolean isReadOnly()
  {
    return read_only;
  }

  /**
   * @return the named bucket, or null if it was never opened with DB.openBucket()
   */
  public abstract DBBucket getBucket(String name);

  protected void checkWritable()
  {
    if (read_only)
    {
      throw new IllegalStateException("Write attempted in read-only transaction");
    }
  }

}
