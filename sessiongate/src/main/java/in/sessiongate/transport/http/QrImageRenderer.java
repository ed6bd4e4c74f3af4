package in.sessiongate.transport.http;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.EncodeHintType;
import com.google.zxing.WriterException;
import com.google.zxing.client.j2se.MatrixToImageWriter;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.qrcode.QRCodeWriter;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Renders a QR challenge as a PNG.
 */
public final class QrImageRenderer {

    public static final int DEFAULT_SIZE = 320;

    private final int size;

    public QrImageRenderer() {
        this(DEFAULT_SIZE);
    }

    public QrImageRenderer(int size) {
        if (size < 64) {
            throw new IllegalArgumentException("QR size must be >= 64");
        }
        this.size = size;
    }

    public byte[] renderPng(String challenge) {
        try {
            BitMatrix matrix = new QRCodeWriter().encode(challenge, BarcodeFormat.QR_CODE, size, size,
                Map.of(EncodeHintType.MARGIN, 1));
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            MatrixToImageWriter.writeToStream(matrix, "PNG", out);
            return out.toByteArray();
        } catch (WriterException e) {
            throw new IllegalArgumentException("QR challenge not encodable: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
