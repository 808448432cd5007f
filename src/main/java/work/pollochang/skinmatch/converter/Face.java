package work.pollochang.skinmatch.converter;

/**
 * 立方體的六個面，以角色本身的方向命名。
 */
public enum Face {
    TOP,
    BOTTOM,
    RIGHT,
    FRONT,
    LEFT,
    BACK
}
