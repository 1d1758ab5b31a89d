package datamigrator.definition.broken;

import datamigrator.definition.MigrationComponent;

@MigrationComponent
public class NotADefinition {
}
