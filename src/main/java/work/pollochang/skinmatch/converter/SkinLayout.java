package work.pollochang.skinmatch.converter;

import java.util.List;

/**
 * 標準人形皮膚貼圖 (64×64) 的格子配置。
 */
public final class SkinLayout {

    public static final int SIZE = 64;

    /**
     * 正面偏左視角的渲染圖中看得到的格子：頭的正/左/上、身體的正/左、四肢正面。
     * 順序固定，區域比對依此順序串接像素。
     */
    public static final List<Cell> VISIBLE_CELLS = List.of(
            BodyPart.HEAD.cell(Face.FRONT),
            BodyPart.HEAD.cell(Face.LEFT),
            BodyPart.HEAD.cell(Face.TOP),
            BodyPart.BODY.cell(Face.FRONT),
            BodyPart.BODY.cell(Face.LEFT),
            BodyPart.RIGHT_ARM.cell(Face.FRONT),
            BodyPart.LEFT_ARM.cell(Face.FRONT),
            BodyPart.RIGHT_LEG.cell(Face.FRONT),
            BodyPart.LEFT_LEG.cell(Face.FRONT)
    );

    public static final int VISIBLE_PIXEL_COUNT = VISIBLE_CELLS.stream().mapToInt(Cell::pixelCount).sum();

    private SkinLayout() {}
}
