package io.dbkit.jdbc.session;

import io.dbkit.DbKitException;
import io.dbkit.ErrorKind;

/**
 * Beginning, committing, rolling back or releasing a transaction scope failed.
 */
public class TransactionException extends DbKitException {

  public TransactionException(String message, Throwable cause) {
    super(ErrorKind.TRANSACTION, message, cause);
  }
}
