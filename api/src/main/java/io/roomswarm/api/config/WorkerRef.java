package io.roomswarm.api.config;

import java.io.Serializable;
import java.net.URI;

public class WorkerRef implements Serializable {
   public final int index;
   public final String url;

   public WorkerRef(int index, String url) {
      this.index = index;
      this.url = url;
   }

   public String host() {
      return URI.create(url).getHost();
   }

   public int port() {
      URI uri = URI.create(url);
      if (uri.getPort() >= 0) {
         return uri.getPort();
      }
      return "https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
   }

   public boolean ssl() {
      return "https".equalsIgnoreCase(URI.create(url).getScheme());
   }

   @Override
   public String toString() {
      return "worker-" + index + " (" + url + ")";
   }
}
