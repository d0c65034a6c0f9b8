package cafe.woden.logbrowser.filter;

/** Whether a rule keeps the lines it matches or drops them. */
public enum FilterKind {
  INCLUDE,
  EXCLUDE
}
