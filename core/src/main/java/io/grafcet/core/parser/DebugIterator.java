package io.grafcet.core.parser;

import java.util.Iterator;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.events.MappingEndEvent;
import org.yaml.snakeyaml.events.MappingStartEvent;
import org.yaml.snakeyaml.events.SequenceEndEvent;
import org.yaml.snakeyaml.events.SequenceStartEvent;

/**
 * Logs every YAML event as it is consumed, indented by nesting depth.
 */
class DebugIterator<T> implements Iterator<T> {
   private static final Logger log = LogManager.getLogger(DebugIterator.class);

   private final Iterator<T> it;
   private String indent = "";

   DebugIterator(Iterator<T> it) {
      this.it = it;
   }

   @Override
   public boolean hasNext() {
      return it.hasNext();
   }

   @Override
   public T next() {
      T event = it.next();
      if ((event instanceof MappingEndEvent || event instanceof SequenceEndEvent) && indent.length() >= 2) {
         indent = indent.substring(2);
      }
      log.info("{}{}", indent, event);
      if (event instanceof MappingStartEvent || event instanceof SequenceStartEvent) {
         indent += "| ";
      }
      return event;
   }
}
