/**
 * Command dispatch: sub-command classification, the alias registry with exact and fuzzy lookup,
 * light actions and the undo stack.
 */
package com.phillippitts.huevoice.service.dispatch;
