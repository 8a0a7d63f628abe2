package io.flightqc.domain.remote;

/** Kind of entry reported by a remote listing or stat call. */
public enum EntryType {
  FILE,
  DIRECTORY,
  OTHER
}
