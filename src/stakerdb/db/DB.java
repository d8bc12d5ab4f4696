package stakerdb.db;

import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import stakerdb.Config;
import stakerdb.EventLog;
import stakerdb.StakerDBException;
import stakerdb.TimeRecord;

/**
 * Key-value backend with named buckets, ordered cursors and
 * atomic read-only / read-write transactions.
 */
public abstract class DB
{
  protected Config conf;
  protected EventLog log;

  private final TreeSet<String> bucket_names = new TreeSet<>();
  private final DBShutdownThread shutdown_thread;
  private volatile boolean closed = false;

  // read held by every view, update and openBucket, write by close
  private final ReentrantReadWriteLock close_lock = new ReentrantReadWriteLock();

  public DB(Config conf, EventLog log)
  {
    this.conf = conf;
    this.log = log;

    shutdown_thread = new DBShutdownThread();
    Runtime.getRuntime().addShutdownHook(shutdown_thread);
  }

  /**
   * Creates the named bucket if it does not already exist.
   * Safe to call again for a bucket that is already open.
   */
  public final void openBucket(String name)
  {
    close_lock.readLock().lock();
    try
    {
      checkOpen();
      synchronized(this)
      {
        if (bucket_names.contains(name)) return;

        openBucketInternal(name);
        bucket_names.add(name);
      }
    }
    finally
    {
      close_lock.readLock().unlock();
    }
  }

  protected abstract void openBucketInternal(String name);

  public synchronized Set<String> getBucketNames()
  {
    return new TreeSet<String>(bucket_names);
  }

  public synchronized boolean hasBucket(String name)
  {
    return bucket_names.contains(name);
  }

  /**
   * Runs the action against a consistent read-only snapshot.
   */
  public final <T> T view(DBAction<T> action)
    throws StakerDBException
  {
    close_lock.readLock().lock();
    long t1 = System.nanoTime();
    try
    {
      checkOpen();
      return viewInternal(action);
    }
    finally
    {
      TimeRecord.record(t1, "db_view");
      close_lock.readLock().unlock();
    }
  }

  /**
   * Runs the action in a read-write transaction.  Everything it wrote is
   * committed together if it returns normally and discarded if it throws.
   * Only one update commits at a time.
   */
  public final <T> T update(DBAction<T> action)
    throws StakerDBException
  {
    close_lock.readLock().lock();
    long t1 = System.nanoTime();
    try
    {
      checkOpen();
      return updateInternal(action);
    }
    finally
    {
      TimeRecord.record(t1, "db_update");
      close_lock.readLock().unlock();
    }
  }

  protected abstract <T> T viewInternal(DBAction<T> action) throws StakerDBException;
  protected abstract <T> T updateInternal(DBAction<T> action) throws StakerDBException;

  public boolean isClosed()
  {
    return closed;
  }

  /**
   * Waits for views and updates in progress to finish.
   * Must not be called from inside a view or update.
   */
  public void close()
  {
    close_lock.writeLock().lock();
    try
    {
      if (closed) return;
      closed = true;

      try
      {
        Runtime.getRuntime().removeShutdownHook(shutdown_thread);
      }
      catch(IllegalStateException e)
      {
        // already shutting down, the hook is running or about to
      }

      dbShutdownHandler();
    }
    catch(Exception e)
    {
      throw new RuntimeException(e);
    }
    finally
    {
      close_lock.writeLock().unlock();
    }
  }

  protected void checkOpen()
  {
    if (closed) throw new IllegalStateException("DB is closed");
  }

  /** Override if the database needs to do something on shutdown */
  protected void dbShutdownHandler() throws Exception
  {

  }

  public class DBShutdownThread extends Thread
  {
    public DBShutdownThread()
    {
      setName("DBShutdownHandler");
    }

    public void run()
    {
      close_lock.writeLock().lock();
      try
      {
        if (closed) return;
        closed = true;
        dbShutdownHandler();
      }
      catch(Throwable t)
      {
        System.out.println("Exception in DB shutdown: " + t);
        t.printStackTrace();
      }
      finally
      {
        close_lock.writeLock().unlock();
      }
    }

  }
}
