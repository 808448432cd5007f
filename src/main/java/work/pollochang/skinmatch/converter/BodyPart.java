package work.pollochang.skinmatch.converter;

/**
 * 64×64 皮膚貼圖上的身體部位。
 * 每個部位是寬 W、高 H、深 D 的立方體，展開後的六個面依固定規則排在 (u, v) 起點右下方。
 */
public enum BodyPart {
    HEAD(0, 0, 8, 8, 8),
    BODY(16, 16, 8, 12, 4),
    RIGHT_ARM(40, 16, 4, 12, 4),
    LEFT_ARM(32, 48, 4, 12, 4),
    RIGHT_LEG(0, 16, 4, 12, 4),
    LEFT_LEG(16, 48, 4, 12, 4);

    private final int u;
    private final int v;
    private final int width;
    private final int height;
    private final int depth;

    BodyPart(int u, int v, int width, int height, int depth) {
        this.u = u;
        this.v = v;
        this.width = width;
        this.height = height;
        this.depth = depth;
    }

    public Cell cell(Face face) {
        switch (face) {
            case TOP:
                return new Cell(this, face, u + depth, v, width, depth);
            case BOTTOM:
                return new Cell(this, face, u + depth + width, v, width, depth);
            case RIGHT:
                return new Cell(this, face, u, v + depth, depth, height);
            case FRONT:
                return new Cell(this, face, u + depth, v + depth, width, height);
            case LEFT:
                return new Cell(this, face, u + depth + width, v + depth, depth, height);
            case BACK:
                return new Cell(this, face, u + 2 * depth + width, v + depth, width, height);
            default:
                throw new IllegalArgumentException("未知的面: " + face);
        }
    }
}
