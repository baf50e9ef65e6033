package hep.dec.common.lang;

/**
 * Global PHOTOS setting of a decay file: 'yesPhotos' or 'noPhotos'.
 * Files without either statement have PHOTOS disabled.
 */
public enum PhotosFlag {
  ENABLED,
  DISABLED;

  public boolean enabled() {
    return this == ENABLED;
  }
}
