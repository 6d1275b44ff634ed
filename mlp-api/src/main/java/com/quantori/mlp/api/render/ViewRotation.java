package com.quantori.mlp.api.render;

/**
 * Viewer orientation in degrees. Yaw turns the molecule about the vertical axis, pitch about the
 * horizontal one.
 *
 * @param pitch rotation about the X axis, applied after yaw
 * @param yaw   rotation about the Y axis
 */
public record ViewRotation(double pitch, double yaw) {

  public static final ViewRotation NONE = new ViewRotation(0, 0);

  /** Degrees turned per pixel of pointer drag. */
  public static final double DRAG_DEGREES_PER_PIXEL = 0.5;

  public static ViewRotation of(double pitch, double yaw) {
    return new ViewRotation(pitch, yaw);
  }

  public boolean isFinite() {
    return Double.isFinite(pitch) && Double.isFinite(yaw);
  }

  /**
   * Rotation after a pointer drag: horizontal movement turns yaw, vertical movement turns pitch.
   *
   * @param deltaX horizontal pointer movement in pixels
   * @param deltaY vertical pointer movement in pixels
   * @return the new rotation
   */
  public ViewRotation dragBy(double deltaX, double deltaY) {
    return new ViewRotation(
        pitch + deltaY * DRAG_DEGREES_PER_PIXEL, yaw + deltaX * DRAG_DEGREES_PER_PIXEL);
  }

  public ViewRotation turnYaw(double degrees) {
    return new ViewRotation(pitch, yaw + degrees);
  }
}
