package org.lupenghan.docdb.store.Impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.lupenghan.docdb.schema.models.Document;
import org.lupenghan.docdb.schema.models.Role;
import org.lupenghan.docdb.schema.models.Table;
import org.lupenghan.docdb.schema.models.TablePermission;
import org.lupenghan.docdb.store.DocumentDigest;
import org.lupenghan.docdb.store.interfaces.DocumentStore;
import org.lupenghan.docdb.store.models.DocumentSummary;
import org.lupenghan.docdb.store.models.PermissionSummary;
import org.lupenghan.docdb.store.models.RoleSummary;
import org.lupenghan.docdb.store.models.TableSummary;
import org.lupenghan.docdb.utils.Json;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * 以单个 JSON 文件保存整个文档。
 * 写盘时先写临时文件再原子替换；可选地在 {@code <path>.lock} 上持有操作系统文件锁，保证跨进程只有一个写者
 */
@Slf4j
public class JsonDocumentStore implements DocumentStore {
    private final Path path;
    private final Clock clock;
    private final String superuserRole;
    private final boolean lockFileEnabled;
    private final ObjectMapper mapper = Json.mapper();
    private final ReentrantReadWriteLock rwLock = new ReentrantReadWriteLock();

    private Document document;
    private long persistedRevision = -1;
    private FileChannel lockChannel;
    private FileLock fileLock;

    /**
     * @param path 文档文件路径
     * @param clock 时钟
     * @param superuserRole 新文档中内置的超级用户角色
     * @param lockFileEnabled 是否启用跨进程文件锁
     */
    public JsonDocumentStore(Path path, Clock clock, String superuserRole, boolean lockFileEnabled) {
        this.path = path;
        this.clock = clock;
        this.superuserRole = superuserRole;
        this.lockFileEnabled = lockFileEnabled;
    }

    @Override
    public void load() throws IOException {
        rwLock.writeLock().lock();
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (lockFileEnabled && fileLock == null) {
                acquireFileLock();
            }
            if (Files.exists(path)) {
                Document loaded = mapper.readValue(path.toFile(), Document.class);
                if (loaded.getMeta() == null) {
                    throw new IOException("Database file " + path + " has no meta section");
                }
                if (loaded.getMeta().getVersion() > Document.CURRENT_VERSION) {
                    throw new IOException("Database file " + path + " has version " + loaded.getMeta().getVersion()
                            + ", newer than the supported version " + Document.CURRENT_VERSION);
                }
                document = loaded;
                persistedRevision = loaded.revision();
                log.info("📂 加载数据库 {}: {} 张表, revision={}", path, loaded.getTables().size(), loaded.revision());
            } else {
                document = Document.fresh(superuserRole, clock.instant());
                log.info("数据库文件不存在，创建新文档: {}", path);
                write();
            }
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    private void acquireFileLock() throws IOException {
        Path lockPath = path.resolveSibling(path.getFileName() + ".lock");
        FileChannel channel = FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        FileLock lock;
        try {
            lock = channel.tryLock();
        } catch (OverlappingFileLockException e) {
            channel.close();
            throw new IOException("Database " + path + " is already open in this process", e);
        }
        if (lock == null) {
            channel.close();
            throw new IOException("Database " + path + " is locked by another process");
        }
        lockChannel = channel;
        fileLock = lock;
        log.debug("获得文件锁: {}", lockPath);
    }

    @Override
    public Document getDocument() {
        if (document == null) {
            throw new IllegalStateException("Document store has not been loaded: " + path);
        }
        return document;
    }

    @Override
    public void persist() throws IOException {
        rwLock.writeLock().lock();
        try {
            getDocument();
            write();
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public boolean persistIfDirty() throws IOException {
        rwLock.writeLock().lock();
        try {
            if (!isDirty()) {
                return false;
            }
            write();
            return true;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public boolean isDirty() {
        return document != null && document.revision() != persistedRevision;
    }

    /**
     * 写临时文件后原子替换目标文件，调用方持有写锁
     */
    private void write() throws IOException {
        Path target = path.toAbsolutePath();
        Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), document);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("文件系统不支持原子替换，改用普通替换: {}", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            log.error("❌ 数据库写入失败: {}", target, e);
            Files.deleteIfExists(temp);
            throw e;
        }
        persistedRevision = document.revision();
        log.debug("数据库已写入 {} (revision={})", target, persistedRevision);
    }

    @Override
    public Lock readLock() {
        return rwLock.readLock();
    }

    @Override
    public Lock writeLock() {
        return rwLock.writeLock();
    }

    @Override
    public DocumentSummary getSummary() {
        rwLock.readLock().lock();
        try {
            Document doc = getDocument();
            List<TableSummary> tables = new ArrayList<>();
            for (Table table : doc.getTables().values()) {
                tables.add(summarize(table));
            }
            List<RoleSummary> roles = doc.getRoles().values().stream()
                    .map(JsonDocumentStore::summarize)
                    .collect(Collectors.toList());
            return DocumentSummary.builder()
                    .meta(doc.getMeta().toBuilder().build())
                    .tables(List.copyOf(tables))
                    .roles(List.copyOf(roles))
                    .build();
        } finally {
            rwLock.readLock().unlock();
        }
    }

    private static TableSummary summarize(Table table) {
        List<PermissionSummary> permissions = new ArrayList<>();
        for (TablePermission permission : table.getPermissions().values()) {
            permissions.add(PermissionSummary.builder()
                    .role(permission.getRole())
                    .privileges(List.copyOf(permission.getPrivileges()))
                    .build());
        }
        return TableSummary.builder()
                .name(table.getName())
                .description(table.getDescription())
                .primaryKey(table.getPrimaryKey())
                .columnCount(table.getColumnOrder().size())
                .rowCount(table.getRows().size())
                .updatedAt(table.getUpdatedAt())
                .columns(table.getColumnOrder().stream()
                        .map(name -> table.column(name).toBuilder().build())
                        .collect(Collectors.toUnmodifiableList()))
                .permissions(List.copyOf(permissions))
                .build();
    }

    private static RoleSummary summarize(Role role) {
        return RoleSummary.builder()
                .name(role.getName())
                .description(role.getDescription())
                .updatedAt(role.getUpdatedAt())
                .build();
    }

    @Override
    public String getDigest(int maxRows) {
        rwLock.readLock().lock();
        try {
            return DocumentDigest.format(getDocument(), maxRows);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public Path getPath() {
        return path;
    }

    @Override
    public void close() throws IOException {
        rwLock.writeLock().lock();
        try {
            if (document != null) {
                persistIfDirty();
            }
        } finally {
            try {
                releaseFileLock();
            } finally {
                rwLock.writeLock().unlock();
            }
        }
    }

    private void releaseFileLock() throws IOException {
        if (fileLock != null) {
            fileLock.release();
            fileLock = null;
        }
        if (lockChannel != null) {
            lockChannel.close();
            lockChannel = null;
        }
    }
}
