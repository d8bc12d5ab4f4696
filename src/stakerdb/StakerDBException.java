package stakerdb;

public class StakerDBException extends Exception
{
  private final StoreError error;

  public StakerDBException(StoreError error, String msg)
  {
    super(error + ": " + msg);
    this.error = error;
  }

  public StakerDBException(StoreError error, String msg, Throwable cause)
  {
    super(error + ": " + msg, cause);
    this.error = error;
  }

  public StoreError getError()
  {
    return error;
  }

}
