package stakerdb.db;

import java.util.Comparator;
import com.google.protobuf.ByteString;

/**
 * Unsigned lexicographic order, the order RocksDB keeps keys in.
 */
public class ByteStringComparator implements Comparator<ByteString>
{
  public int compare(ByteString a, ByteString b)
  {
    int n = Math.min(a.size(), b.size());
    for(int i=0; i<n; i++)
    {
      int x = a.byteAt(i) & 0xff;
      int y = b.byteAt(i) & 0xff;
      if (x != y) return Integer.compare(x, y);
    }
    return Integer.compare(a.size(), b.size());
  }
}
