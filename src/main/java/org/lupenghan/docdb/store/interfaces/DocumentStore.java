package org.lupenghan.docdb.store.interfaces;

import org.lupenghan.docdb.schema.models.Document;
import org.lupenghan.docdb.store.models.DocumentSummary;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.locks.Lock;

/**
 * 文档存储：负责加载、持久化以及读写锁
 */
public interface DocumentStore extends Closeable {
    /**
     * 从磁盘加载文档，文件不存在时创建新文档并立即写入
     */
    void load() throws IOException;

    /**
     * 内存中的文档。调用方需要持有对应的读锁或写锁
     * @throws IllegalStateException 尚未调用 load()
     */
    Document getDocument();

    void persist() throws IOException;

    /**
     * 只有 revision 与上次持久化时不同时才写盘
     * @return 是否写盘
     */
    boolean persistIfDirty() throws IOException;

    boolean isDirty();

    Lock readLock();

    Lock writeLock();

    DocumentSummary getSummary();

    String getDigest(int maxRows);

    Path getPath();
}
