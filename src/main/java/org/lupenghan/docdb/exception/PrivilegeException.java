package org.lupenghan.docdb.exception;

/**
 * 角色缺少执行操作所需的权限
 */
public class PrivilegeException extends OperationException {
    public PrivilegeException(String message) {
        super(ErrorKind.PRIVILEGE, message);
    }
}
