package com.mini.fts.format;

import com.mini.fts.exception.HostFileException;
import com.mini.fts.schema.DataType;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * 列块编解码
 * 每个值前有 1 字节空值标记；LONG 为 8 字节，STRING 为 4 字节长度加 UTF-8 字节
 */
final class ColumnCodec {
    
    private static final byte NULL = 0;
    private static final byte PRESENT = 1;
    
    private ColumnCodec() {
    }
    
    static byte[] encode(DataType type, List<Object> values) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        DataOutputStream dos = new DataOutputStream(baos);
        
        for (Object value : values) {
            if (value == null) {
                dos.writeByte(NULL);
                continue;
            }
            dos.writeByte(PRESENT);
            switch (type) {
                case LONG:
                    dos.writeLong((Long) value);
                    break;
                case STRING:
                    byte[] bytes = ((String) value).getBytes(StandardCharsets.UTF_8);
                    dos.writeInt(bytes.length);
                    dos.write(bytes);
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported type: " + type);
            }
        }
        
        dos.flush();
        return baos.toByteArray();
    }
    
    static List<Object> decode(DataType type, byte[] data, long rowCount) throws IOException {
        DataInputStream dis = new DataInputStream(new ByteArrayInputStream(data));
        List<Object> values = new ArrayList<>((int) rowCount);
        
        for (long i = 0; i < rowCount; i++) {
            byte flag = dis.readByte();
            if (flag == NULL) {
                values.add(null);
                continue;
            }
            if (flag != PRESENT) {
                throw new HostFileException("Invalid null flag " + flag + " in column chunk");
            }
            switch (type) {
                case LONG:
                    values.add(dis.readLong());
                    break;
                case STRING:
                    byte[] bytes = new byte[dis.readInt()];
                    dis.readFully(bytes);
                    values.add(new String(bytes, StandardCharsets.UTF_8));
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported type: " + type);
            }
        }
        
        return values;
    }
}
