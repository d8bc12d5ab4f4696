package stakerdb;

import org.bitcoinj.core.NetworkParameters;

import stakerdb.db.DB;

/**
 * Opens the tracked transaction store described by a config file.
 */
public class StakerDB
{
  private Config config;
  private EventLog event_log;
  private NetworkParameters network_params;
  private DB db;
  private TrackedTransactionStore store;
  private PageParams.Limits page_limits;

  public StakerDB(Config conf)
    throws Exception
  {
    this(conf, new EventLog(conf));
  }

  public StakerDB(Config conf, EventLog event_log)
    throws Exception
  {
    config = conf;
    this.event_log = event_log;

    network_params = Util.getNetworkParameters(config);
    page_limits = PageParams.Limits.fromConfig(config);

    config.require("db_type");
    String db_type = config.get("db_type");

    if (db_type.equals("rocksdb"))
    {
      db = new stakerdb.db.rocksdb.JRocksDB(config, event_log);
    }
    else if (db_type.equals("memory"))
    {
      db = new stakerdb.db.memory.MemoryDB(config, event_log);
    }
    else
    {
      throw new IllegalArgumentException("Unknown db_type: " + db_type + ", try rocksdb or memory");
    }

    store = new TrackedTransactionStore(db, event_log);
    event_log.log("Opened " + db_type + " store for " + network_params.getId());
  }

  public Config getConfig(){ return config; }
  public EventLog getEventLog(){ return event_log; }
  public NetworkParameters getNetworkParameters(){ return network_params; }
  public DB getDB(){ return db; }
  public TrackedTransactionStore getStore(){ return store; }
  public PageParams.Limits getPageLimits(){ return page_limits; }

  public void close()
  {
    db.close();
    event_log.log("Closed store");
  }

}
