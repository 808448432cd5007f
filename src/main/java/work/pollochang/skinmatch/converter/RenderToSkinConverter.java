package work.pollochang.skinmatch.converter;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.skinmatch.core.ImageHandle;
import work.pollochang.skinmatch.tools.ImageTools;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * 將任意尺寸的 3D 角色渲染圖轉成 64×64 皮膚貼圖。
 * <p>
 * 以固定比例把渲染圖切成頭、身體、腿三個區塊，再從各區塊裁出對應的子區域，
 * 以面積平均縮放填入貼圖格子。渲染圖中看不到的面 (背面、底面、另一側)
 * 以可見面的平均色填滿，底面與四肢側面再乘上 {@link #SHADE_FACTOR} 模擬陰影。
 * 這是近似值，並非幾何重建。
 */
@Slf4j
public final class RenderToSkinConverter {

    public static final double SHADE_FACTOR = 0.8;

    private static final int OPAQUE_THRESHOLD = 128;

    private RenderToSkinConverter() {}

    /**
     * 轉換渲染圖。輸入恰為 64×64 時視為已是皮膚，原樣回傳。
     */
    public static ImageHandle convert(ImageHandle render) {
        Objects.requireNonNull(render, "render must not be null");
        if (render.width() == SkinLayout.SIZE && render.height() == SkinLayout.SIZE) {
            return render;
        }
        log.debug("轉換渲染圖 {}x{} -> 皮膚貼圖", render.width(), render.height());

        int w = render.width();
        int h = render.height();
        int[] skin = new int[SkinLayout.SIZE * SkinLayout.SIZE];

        // 頭、身體、腿的外框
        Box head = new Box((int) (w * 0.35), (int) (h * 0.05), (int) (w * 0.65), (int) (h * 0.35));
        Box body = new Box((int) (w * 0.35), (int) (h * 0.35), (int) (w * 0.65), (int) (h * 0.70));
        Box legs = new Box((int) (w * 0.35), (int) (h * 0.70), (int) (w * 0.65), (int) (h * 0.95));

        Map<Face, int[]> headFaces = new EnumMap<>(Face.class);
        headFaces.put(Face.FRONT, head.crop(render, 0.3, 0.4, 0.7, 0.8, BodyPart.HEAD.cell(Face.FRONT)));
        headFaces.put(Face.LEFT, head.crop(render, 0.0, 0.4, 0.3, 0.8, BodyPart.HEAD.cell(Face.LEFT)));
        headFaces.put(Face.TOP, head.crop(render, 0.3, 0.0, 0.7, 0.3, BodyPart.HEAD.cell(Face.TOP)));
        paintPart(skin, BodyPart.HEAD, headFaces);

        Map<Face, int[]> bodyFaces = new EnumMap<>(Face.class);
        bodyFaces.put(Face.FRONT, body.crop(render, 0.25, 0.1, 0.75, 1.0, BodyPart.BODY.cell(Face.FRONT)));
        bodyFaces.put(Face.LEFT, body.crop(render, 0.0, 0.1, 0.25, 1.0, BodyPart.BODY.cell(Face.LEFT)));
        paintPart(skin, BodyPart.BODY, bodyFaces);

        // 手臂位於身體外框兩側
        Map<Face, int[]> rightArm = new EnumMap<>(Face.class);
        rightArm.put(Face.FRONT, body.crop(render, -0.15, 0.1, 0.0, 1.0, BodyPart.RIGHT_ARM.cell(Face.FRONT)));
        paintPart(skin, BodyPart.RIGHT_ARM, rightArm);

        Map<Face, int[]> leftArm = new EnumMap<>(Face.class);
        leftArm.put(Face.FRONT, body.crop(render, 1.0, 0.1, 1.15, 1.0, BodyPart.LEFT_ARM.cell(Face.FRONT)));
        paintPart(skin, BodyPart.LEFT_ARM, leftArm);

        Map<Face, int[]> rightLeg = new EnumMap<>(Face.class);
        rightLeg.put(Face.FRONT, legs.crop(render, 0.2, 0.0, 0.4, 1.0, BodyPart.RIGHT_LEG.cell(Face.FRONT)));
        paintPart(skin, BodyPart.RIGHT_LEG, rightLeg);

        Map<Face, int[]> leftLeg = new EnumMap<>(Face.class);
        leftLeg.put(Face.FRONT, legs.crop(render, 0.6, 0.0, 0.8, 1.0, BodyPart.LEFT_LEG.cell(Face.FRONT)));
        paintPart(skin, BodyPart.LEFT_LEG, leftLeg);

        return ImageHandle.ofArgb(SkinLayout.SIZE, SkinLayout.SIZE, skin);
    }

    /**
     * 依 {@link SkinLayout#VISIBLE_CELLS} 的順序串接可見格子的 RGBA 通道值 (每像素 4 個數值)。
     * 輸入必須是 64×64 貼圖。
     */
    public static int[] visibleRegionChannels(ImageHandle skin) {
        if (skin.width() != SkinLayout.SIZE || skin.height() != SkinLayout.SIZE) {
            throw new IllegalArgumentException("需要 64x64 皮膚貼圖，實際為 " + skin.width() + "x" + skin.height());
        }
        int[] channels = new int[SkinLayout.VISIBLE_PIXEL_COUNT * 4];
        int i = 0;
        for (Cell cell : SkinLayout.VISIBLE_CELLS) {
            for (int y = cell.y(); y < cell.y() + cell.height(); y++) {
                for (int x = cell.x(); x < cell.x() + cell.width(); x++) {
                    int argb = skin.argb(x, y);
                    channels[i++] = (argb >> 16) & 0xFF;
                    channels[i++] = (argb >> 8) & 0xFF;
                    channels[i++] = argb & 0xFF;
                    channels[i++] = skin.alpha(x, y);
                }
            }
        }
        return channels;
    }

    /**
     * 填入已觀察到的面，其餘面由正面推算。
     */
    private static void paintPart(int[] skin, BodyPart part, Map<Face, int[]> observed) {
        int[] front = observed.get(Face.FRONT);
        int average = averageColor(front);
        int shaded = shade(average, SHADE_FACTOR);

        for (Face face : Face.values()) {
            Cell cell = part.cell(face);
            int[] pixels = observed.get(face);
            if (pixels == null) {
                if (face == Face.RIGHT && observed.containsKey(Face.LEFT)) {
                    pixels = ImageTools.mirror(observed.get(Face.LEFT), cell.width(), cell.height());
                } else {
                    pixels = fill(cell, faceFill(part, face, average, shaded));
                }
            }
            paint(skin, cell, pixels);
        }
    }

    private static int faceFill(BodyPart part, Face face, int average, int shaded) {
        switch (face) {
            case BOTTOM:
                return shaded;
            case LEFT:
            case RIGHT:
                return part == BodyPart.HEAD || part == BodyPart.BODY ? average : shaded;
            default:
                return average;
        }
    }

    private static void paint(int[] skin, Cell cell, int[] pixels) {
        for (int y = 0; y < cell.height(); y++) {
            System.arraycopy(pixels, y * cell.width(), skin, (cell.y() + y) * SkinLayout.SIZE + cell.x(), cell.width());
        }
    }

    private static int[] fill(Cell cell, int argb) {
        int[] pixels = new int[cell.pixelCount()];
        Arrays.fill(pixels, argb);
        return pixels;
    }

    /**
     * 不透明像素 (alpha > 128) 的平均色，結果固定為不透明；沒有不透明像素時為黑色。
     */
    static int averageColor(int[] pixels) {
        long r = 0, g = 0, b = 0;
        int count = 0;
        for (int argb : pixels) {
            if ((argb >>> 24) > OPAQUE_THRESHOLD) {
                r += (argb >> 16) & 0xFF;
                g += (argb >> 8) & 0xFF;
                b += argb & 0xFF;
                count++;
            }
        }
        if (count == 0) {
            return 0xFF000000;
        }
        return ImageTools.pack(0xFF, (int) (r / count), (int) (g / count), (int) (b / count));
    }

    /**
     * 只調暗 RGB，透明度不變。
     */
    static int shade(int argb, double factor) {
        return ImageTools.pack(argb >>> 24,
                (int) (((argb >> 16) & 0xFF) * factor),
                (int) (((argb >> 8) & 0xFF) * factor),
                (int) ((argb & 0xFF) * factor));
    }

    /**
     * 渲染圖上的矩形區塊 [left, right) x [top, bottom)。
     */
    private record Box(int left, int top, int right, int bottom) {

        /**
         * 以區塊寬高的比例取出子區域 (可超出區塊範圍，但會截斷在圖片內)，縮放到格子大小。
         */
        int[] crop(ImageHandle image, double fx0, double fy0, double fx1, double fy1, Cell target) {
            int width = right - left;
            int height = bottom - top;
            int x0 = Math.max(0, left + (int) (width * fx0));
            int x1 = Math.min(image.width(), left + (int) (width * fx1));
            int y0 = Math.max(0, top + (int) (height * fy0));
            int y1 = Math.min(image.height(), top + (int) (height * fy1));
            return ImageTools.resizeArea(image, x0, y0, x1, y1, target.width(), target.height());
        }
    }
}
