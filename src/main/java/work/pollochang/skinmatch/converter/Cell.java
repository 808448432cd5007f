package work.pollochang.skinmatch.converter;

/**
 * 貼圖上的一個矩形格子。
 */
public record Cell(BodyPart part, Face face, int x, int y, int width, int height) {

    public int pixelCount() {
        return width * height;
    }
}
