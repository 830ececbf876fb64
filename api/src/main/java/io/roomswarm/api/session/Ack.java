package io.roomswarm.api.session;

public enum Ack {
   APPLIED,
   /** Accepted but nothing changed, e.g. closing an already closed participant. */
   NO_OP
}
